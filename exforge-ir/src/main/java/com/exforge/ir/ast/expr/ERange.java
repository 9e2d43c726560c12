package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 范围 first..last 或 first..last//step
 */
public class ERange extends ElixirNode {
    private final ElixirNode first;
    private final ElixirNode last;
    private final ElixirNode step;

    public ERange(SourceLocation location, ElixirNode first, ElixirNode last, ElixirNode step) {
        super(location);
        this.first = first;
        this.last = last;
        this.step = step;
    }

    public ElixirNode getFirst() {
        return first;
    }

    public ElixirNode getLast() {
        return last;
    }

    /** 可为 null */
    public ElixirNode getStep() {
        return step;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitRange(this, context);
    }
}
