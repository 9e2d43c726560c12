package com.exforge.ir.ast;

import com.exforge.compiler.ast.SourceLocation;

/**
 * 中间 AST 节点基类。
 * <p>
 * 节点不可变；pass 通过构造新节点完成重写。元数据可能为 null，读取方必须容忍缺失。
 */
public abstract class ElixirNode {
    protected final SourceLocation location;
    private Metadata metadata;

    protected ElixirNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 可能为 null */
    public Metadata getMetadata() {
        return metadata;
    }

    public <T> T meta(MetaKey<T> key) {
        return metadata != null ? metadata.get(key) : null;
    }

    public boolean hasFlag(MetaKey<Boolean> key) {
        return metadata != null && metadata.isSet(key);
    }

    /**
     * 设置元数据，返回自身。只在新建节点后立即调用，不用于修改已发布的节点。
     */
    @SuppressWarnings("unchecked")
    public <N extends ElixirNode> N withMetadata(Metadata metadata) {
        this.metadata = metadata != null && !metadata.isEmpty() ? metadata : null;
        return (N) this;
    }

    /** 从旧节点复制元数据，返回自身 */
    public <N extends ElixirNode> N withMetadataFrom(ElixirNode source) {
        return withMetadata(source != null ? source.getMetadata() : null);
    }

    public <T> Metadata metadataWith(MetaKey<T> key, T value) {
        return (metadata != null ? metadata : Metadata.empty()).with(key, value);
    }

    public abstract <R, C> R accept(ElixirVisitor<R, C> visitor, C context);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + location;
    }
}
