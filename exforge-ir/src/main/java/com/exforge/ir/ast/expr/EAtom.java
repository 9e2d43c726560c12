package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 原子 :name
 */
public class EAtom extends ElixirNode {
    private final String name;

    public EAtom(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitAtom(this, context);
    }

    @Override
    public String toString() {
        return "EAtom(" + name + ")";
    }
}
