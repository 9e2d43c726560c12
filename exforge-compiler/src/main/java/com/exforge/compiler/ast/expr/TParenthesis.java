package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * 括号表达式
 */
public class TParenthesis extends TypedExpr {
    private final TypedExpr expr;

    public TParenthesis(SourceLocation location, TypedExpr expr) {
        super(location, expr.getType());
        this.expr = expr;
    }

    public TypedExpr getExpr() {
        return expr;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitParenthesis(this, context);
    }
}
