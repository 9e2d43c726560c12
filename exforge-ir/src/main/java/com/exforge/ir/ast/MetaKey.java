package com.exforge.ir.ast;

/**
 * 元数据键。类型参数保证 get/with 两端类型一致。
 */
public final class MetaKey<T> {
    private final String name;

    private MetaKey(String name) {
        this.name = name;
    }

    public static <T> MetaKey<T> of(String name) {
        return new MetaKey<>(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
