package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * 匿名函数调用 fun.(args)
 */
public class EApply extends ElixirNode {
    private final ElixirNode function;
    private final List<ElixirNode> args;

    public EApply(SourceLocation location, ElixirNode function, List<ElixirNode> args) {
        super(location);
        this.function = function;
        this.args = args;
    }

    public ElixirNode getFunction() {
        return function;
    }

    public List<ElixirNode> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitApply(this, context);
    }
}
