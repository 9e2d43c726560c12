package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;
import com.exforge.compiler.ast.TVariable;

import java.util.List;

/**
 * 函数字面量（lambda）
 */
public class TFunction extends TypedExpr {
    private final List<TVariable> args;
    private final TypedExpr body;

    public TFunction(SourceLocation location, TypeRef type, List<TVariable> args, TypedExpr body) {
        super(location, type);
        this.args = args;
        this.body = body;
    }

    public TFunction(List<TVariable> args, TypedExpr body) {
        this(SourceLocation.UNKNOWN, TypeRef.DYNAMIC, args, body);
    }

    public List<TVariable> getArgs() {
        return args;
    }

    public TypedExpr getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitFunction(this, context);
    }
}
