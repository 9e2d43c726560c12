package com.exforge.ir.ast.pattern;

import com.exforge.compiler.ast.SourceLocation;

/**
 * 变量绑定
 */
public class PVar extends ElixirPattern {
    private final String name;
    private final Integer sourceId;

    public PVar(SourceLocation location, String name, Integer sourceId) {
        super(location);
        this.name = name;
        this.sourceId = sourceId;
    }

    public PVar(SourceLocation location, String name) {
        this(location, name, null);
    }

    public String getName() {
        return name;
    }

    public Integer getSourceId() {
        return sourceId;
    }

    public PVar renamed(String newName) {
        return newName.equals(name) ? this : new PVar(location, newName, sourceId);
    }

    @Override
    public <R, C> R accept(PatternVisitor<R, C> visitor, C context) {
        return visitor.visitVar(this, context);
    }

    @Override
    public String toString() {
        return "PVar(" + name + ")";
    }
}
