package com.exforge.ir.ast.pattern;

import com.exforge.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 元组模式 {a, b}
 */
public class PTuple extends ElixirPattern {
    private final List<ElixirPattern> elements;

    public PTuple(SourceLocation location, List<ElixirPattern> elements) {
        super(location);
        this.elements = elements;
    }

    public List<ElixirPattern> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(PatternVisitor<R, C> visitor, C context) {
        return visitor.visitTuple(this, context);
    }
}
