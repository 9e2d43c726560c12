package com.exforge.ir.ast.pattern;

import com.exforge.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 头尾模式 [h1, h2 | tail]
 */
public class PCons extends ElixirPattern {
    private final List<ElixirPattern> heads;
    private final ElixirPattern tail;

    public PCons(SourceLocation location, List<ElixirPattern> heads, ElixirPattern tail) {
        super(location);
        this.heads = heads;
        this.tail = tail;
    }

    public List<ElixirPattern> getHeads() {
        return heads;
    }

    public ElixirPattern getTail() {
        return tail;
    }

    @Override
    public <R, C> R accept(PatternVisitor<R, C> visitor, C context) {
        return visitor.visitCons(this, context);
    }
}
