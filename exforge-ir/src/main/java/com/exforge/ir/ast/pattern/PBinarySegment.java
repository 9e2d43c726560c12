package com.exforge.ir.ast.pattern;

import com.exforge.ir.ast.ElixirNode;

/**
 * 二进制模式段 pattern::size(n)-type
 */
public final class PBinarySegment {
    private final ElixirPattern pattern;
    private final ElixirNode size;
    private final String type;

    public PBinarySegment(ElixirPattern pattern, ElixirNode size, String type) {
        this.pattern = pattern;
        this.size = size;
        this.type = type;
    }

    public ElixirPattern getPattern() {
        return pattern;
    }

    /** 可为 null */
    public ElixirNode getSize() {
        return size;
    }

    /** 可为 null */
    public String getType() {
        return type;
    }
}
