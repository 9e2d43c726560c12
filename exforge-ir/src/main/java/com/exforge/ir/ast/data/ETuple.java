package com.exforge.ir.ast.data;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * 元组字面量 {a, b}
 */
public class ETuple extends ElixirNode {
    private final List<ElixirNode> elements;

    public ETuple(SourceLocation location, List<ElixirNode> elements) {
        super(location);
        this.elements = elements;
    }

    public List<ElixirNode> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitTuple(this, context);
    }
}
