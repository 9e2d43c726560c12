package com.exforge.ir.ast.data;

import com.exforge.ir.ast.ElixirNode;

/**
 * 位串段 value::type-size(n)
 */
public final class EBitSegment {
    private final ElixirNode value;
    private final ElixirNode size;
    private final String type;

    public EBitSegment(ElixirNode value, ElixirNode size, String type) {
        this.value = value;
        this.size = size;
        this.type = type;
    }

    public ElixirNode getValue() {
        return value;
    }

    /** 可为 null */
    public ElixirNode getSize() {
        return size;
    }

    /** binary / integer / utf8 等，可为 null */
    public String getType() {
        return type;
    }
}
