package com.exforge.compiler.ast;

import com.exforge.compiler.ast.type.TypeRef;

/**
 * 类型化树中的变量绑定。id 在一个编译单元内稳定且唯一，
 * 子句局部解析和模式库都依赖它识别同一绑定。
 */
public final class TVariable {
    private final int id;
    private final String name;
    private final TypeRef type;

    public TVariable(int id, String name, TypeRef type) {
        this.id = id;
        this.name = name;
        this.type = type != null ? type : TypeRef.DYNAMIC;
    }

    public TVariable(int id, String name) {
        this(id, name, TypeRef.DYNAMIC);
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TVariable)) return false;
        return id == ((TVariable) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
