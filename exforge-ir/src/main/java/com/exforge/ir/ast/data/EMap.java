package com.exforge.ir.ast.data;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * map 字面量 %{k => v}，或更新形式 %{base | k => v}
 */
public class EMap extends ElixirNode {
    private final ElixirNode base;
    private final List<EMapEntry> entries;

    public EMap(SourceLocation location, ElixirNode base, List<EMapEntry> entries) {
        super(location);
        this.base = base;
        this.entries = entries;
    }

    public EMap(SourceLocation location, List<EMapEntry> entries) {
        this(location, null, entries);
    }

    /** 更新形式的被更新对象，字面量形式为 null */
    public ElixirNode getBase() {
        return base;
    }

    public List<EMapEntry> getEntries() {
        return entries;
    }

    public boolean isUpdate() {
        return base != null;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitMap(this, context);
    }
}
