package com.exforge.ir.ast.data;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * 列表字面量 [a, b, c]
 */
public class EList extends ElixirNode {
    private final List<ElixirNode> elements;

    public EList(SourceLocation location, List<ElixirNode> elements) {
        super(location);
        this.elements = elements;
    }

    public List<ElixirNode> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitList(this, context);
    }
}
