package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 变量引用。sourceId 是源绑定 id（可为 null），子句局部解析依赖它。
 */
public class EVar extends ElixirNode {
    private final String name;
    private final Integer sourceId;

    public EVar(SourceLocation location, String name, Integer sourceId) {
        super(location);
        this.name = name;
        this.sourceId = sourceId;
    }

    public EVar(SourceLocation location, String name) {
        this(location, name, null);
    }

    public String getName() {
        return name;
    }

    public Integer getSourceId() {
        return sourceId;
    }

    public EVar renamed(String newName) {
        if (newName.equals(name)) return this;
        return new EVar(location, newName, sourceId).withMetadataFrom(this);
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitVar(this, context);
    }

    @Override
    public String toString() {
        return "EVar(" + name + ")";
    }
}
