package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * 本地调用 name(args)
 */
public class ECall extends ElixirNode {
    private final String name;
    private final List<ElixirNode> args;

    public ECall(SourceLocation location, String name, List<ElixirNode> args) {
        super(location);
        this.name = name;
        this.args = args;
    }

    public String getName() {
        return name;
    }

    public List<ElixirNode> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
