package com.exforge.ir.ast.control;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * if cond do ... else ... end，elseBranch 可为 null
 */
public class EIf extends ElixirNode {
    private final ElixirNode condition;
    private final ElixirNode thenBranch;
    private final ElixirNode elseBranch;

    public EIf(SourceLocation location, ElixirNode condition, ElixirNode thenBranch, ElixirNode elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public ElixirNode getCondition() {
        return condition;
    }

    public ElixirNode getThenBranch() {
        return thenBranch;
    }

    public ElixirNode getElseBranch() {
        return elseBranch;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
