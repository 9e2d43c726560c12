package com.exforge.ir.ast.pattern;

import com.exforge.compiler.ast.SourceLocation;

/**
 * 固定已有绑定 ^name。这是读取而不是绑定。
 */
public class PPin extends ElixirPattern {
    private final String name;

    public PPin(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public PPin renamed(String newName) {
        return newName.equals(name) ? this : new PPin(location, newName);
    }

    @Override
    public <R, C> R accept(PatternVisitor<R, C> visitor, C context) {
        return visitor.visitPin(this, context);
    }
}
