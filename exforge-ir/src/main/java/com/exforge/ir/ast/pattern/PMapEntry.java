package com.exforge.ir.ast.pattern;

import com.exforge.ir.ast.ElixirNode;

/**
 * map 模式条目：键是表达式（字面量或原子），值是模式
 */
public final class PMapEntry {
    private final ElixirNode key;
    private final ElixirPattern value;

    public PMapEntry(ElixirNode key, ElixirPattern value) {
        this.key = key;
        this.value = value;
    }

    public ElixirNode getKey() {
        return key;
    }

    public ElixirPattern getValue() {
        return value;
    }
}
