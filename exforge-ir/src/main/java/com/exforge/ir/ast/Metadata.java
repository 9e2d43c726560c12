package com.exforge.ir.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 节点元数据（不可变属性包）。
 * <p>
 * 在 pass 之间传递溯源信息和提示而不改变节点形状。重写产生新节点时由
 * {@link ElixirTransformer} 自动复制到新节点。
 */
public final class Metadata {

    /** 源绑定 id → 目标变量名，用于子句局部变量解析 */
    public static final MetaKey<Map<Integer, String>> CLAUSE_LOCALS = MetaKey.of("clauseLocals");
    /** 保持内联：效果提升 pass 不拆解该块 */
    public static final MetaKey<Boolean> KEEP_INLINE = MetaKey.of("keepInline");
    /** 模块表示异常类型 */
    public static final MetaKey<Boolean> EXCEPTION_MODULE = MetaKey.of("exceptionModule");
    /** 异常模块的字段名 */
    public static final MetaKey<List<String>> EXCEPTION_FIELDS = MetaKey.of("exceptionFields");
    /** 未使用的私有函数（name/arity） */
    public static final MetaKey<List<String>> UNUSED_PRIVATE_FUNCTIONS = MetaKey.of("unusedPrivateFunctions");
    /** 块来自上游循环展开 */
    public static final MetaKey<Boolean> UNROLLED_LOOP = MetaKey.of("unrolledLoop");
    /** 枚举标签 → 元组元数（含标签位） */
    public static final MetaKey<Map<Long, Integer>> ENUM_ARITIES = MetaKey.of("enumArities");
    /** 下标访问的目标是 map 而不是列表 */
    public static final MetaKey<Boolean> MAP_ACCESS = MetaKey.of("mapAccess");
    /** 效果提升的中间载体：前置语句 + 最终值 */
    public static final MetaKey<Boolean> LIFTED = MetaKey.of("lifted");

    private static final Metadata EMPTY = new Metadata(Collections.emptyMap());

    private final Map<MetaKey<?>, Object> values;

    private Metadata(Map<MetaKey<?>, Object> values) {
        this.values = values;
    }

    public static Metadata empty() {
        return EMPTY;
    }

    public static <T> Metadata of(MetaKey<T> key, T value) {
        return EMPTY.with(key, value);
    }

    public <T> Metadata with(MetaKey<T> key, T value) {
        Map<MetaKey<?>, Object> copy = new LinkedHashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new Metadata(Collections.unmodifiableMap(copy));
    }

    public Metadata without(MetaKey<?> key) {
        if (!values.containsKey(key)) return this;
        Map<MetaKey<?>, Object> copy = new LinkedHashMap<>(values);
        copy.remove(key);
        return copy.isEmpty() ? EMPTY : new Metadata(Collections.unmodifiableMap(copy));
    }

    @SuppressWarnings("unchecked")
    public <T> T get(MetaKey<T> key) {
        return (T) values.get(key);
    }

    public boolean has(MetaKey<?> key) {
        return values.containsKey(key);
    }

    /** 布尔标记是否为 true */
    public boolean isSet(MetaKey<Boolean> key) {
        return Boolean.TRUE.equals(values.get(key));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
