package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 表达式位置的 _（丢弃值，例如 _ = call()）
 */
public class EUnderscore extends ElixirNode {

    public EUnderscore(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitUnderscore(this, context);
    }
}
