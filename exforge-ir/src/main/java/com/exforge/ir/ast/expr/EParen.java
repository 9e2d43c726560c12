package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 显式括号
 */
public class EParen extends ElixirNode {
    private final ElixirNode expr;

    public EParen(SourceLocation location, ElixirNode expr) {
        super(location);
        this.expr = expr;
    }

    public ElixirNode getExpr() {
        return expr;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitParen(this, context);
    }
}
