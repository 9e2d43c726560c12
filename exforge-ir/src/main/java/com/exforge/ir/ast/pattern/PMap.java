package com.exforge.ir.ast.pattern;

import com.exforge.compiler.ast.SourceLocation;

import java.util.List;

/**
 * map 模式 %{key => pattern}
 */
public class PMap extends ElixirPattern {
    private final List<PMapEntry> entries;

    public PMap(SourceLocation location, List<PMapEntry> entries) {
        super(location);
        this.entries = entries;
    }

    public List<PMapEntry> getEntries() {
        return entries;
    }

    @Override
    public <R, C> R accept(PatternVisitor<R, C> visitor, C context) {
        return visitor.visitMap(this, context);
    }
}
