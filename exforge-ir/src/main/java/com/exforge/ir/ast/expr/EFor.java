package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * 推导式 for gen, filter, into: x, do: body
 */
public class EFor extends ElixirNode {
    private final List<EForGenerator> generators;
    private final List<ElixirNode> filters;
    private final ElixirNode into;
    private final ElixirNode body;

    public EFor(SourceLocation location, List<EForGenerator> generators, List<ElixirNode> filters,
                ElixirNode into, ElixirNode body) {
        super(location);
        this.generators = generators;
        this.filters = filters;
        this.into = into;
        this.body = body;
    }

    public List<EForGenerator> getGenerators() {
        return generators;
    }

    public List<ElixirNode> getFilters() {
        return filters;
    }

    /** 可为 null */
    public ElixirNode getInto() {
        return into;
    }

    public ElixirNode getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitFor(this, context);
    }
}
