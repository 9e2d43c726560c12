package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * 枚举值的构造器序号
 */
public class TEnumIndex extends TypedExpr {
    private final TypedExpr target;

    public TEnumIndex(SourceLocation location, TypedExpr target) {
        super(location, TypeRef.INT);
        this.target = target;
    }

    public TEnumIndex(TypedExpr target) {
        this(SourceLocation.UNKNOWN, target);
    }

    public TypedExpr getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitEnumIndex(this, context);
    }
}
