package com.exforge.ir.ast.pattern;

import com.exforge.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 定长列表模式 [a, b]
 */
public class PList extends ElixirPattern {
    private final List<ElixirPattern> elements;

    public PList(SourceLocation location, List<ElixirPattern> elements) {
        super(location);
        this.elements = elements;
    }

    public List<ElixirPattern> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(PatternVisitor<R, C> visitor, C context) {
        return visitor.visitList(this, context);
    }
}
