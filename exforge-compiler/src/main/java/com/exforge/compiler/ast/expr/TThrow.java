package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * throw 表达式
 */
public class TThrow extends TypedExpr {
    private final TypedExpr value;

    public TThrow(SourceLocation location, TypedExpr value) {
        super(location, TypeRef.DYNAMIC);
        this.value = value;
    }

    public TypedExpr getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitThrow(this, context);
    }
}
