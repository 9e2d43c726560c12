package com.exforge.ir.ast.data;

import com.exforge.ir.ast.ElixirNode;

/**
 * map 条目 key => value
 */
public final class EMapEntry {
    private final ElixirNode key;
    private final ElixirNode value;

    public EMapEntry(ElixirNode key, ElixirNode value) {
        this.key = key;
        this.value = value;
    }

    public ElixirNode getKey() {
        return key;
    }

    public ElixirNode getValue() {
        return value;
    }
}
