package com.exforge.ir.ast.data;

import com.exforge.ir.ast.ElixirNode;

/**
 * 关键字对 key: value（关键字列表与结构体字段共用）
 */
public final class EKeywordPair {
    private final String key;
    private final ElixirNode value;

    public EKeywordPair(String key, ElixirNode value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public ElixirNode getValue() {
        return value;
    }
}
