package com.exforge.compiler.ast.type;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 前端已解析的类型引用。核心只读取名称和类型参数，不做类型检查。
 */
public final class TypeRef {

    public static final TypeRef DYNAMIC = new TypeRef("Dynamic");
    public static final TypeRef VOID = new TypeRef("Void");
    public static final TypeRef INT = new TypeRef("Int");
    public static final TypeRef FLOAT = new TypeRef("Float");
    public static final TypeRef BOOL = new TypeRef("Bool");
    public static final TypeRef STRING = new TypeRef("String");

    private final String name;
    private final List<TypeRef> params;

    public TypeRef(String name) {
        this(name, Collections.emptyList());
    }

    public TypeRef(String name, List<TypeRef> params) {
        this.name = Objects.requireNonNull(name, "name");
        this.params = params != null ? params : Collections.emptyList();
    }

    public static TypeRef arrayOf(TypeRef element) {
        return new TypeRef("Array", Collections.singletonList(element));
    }

    public static TypeRef named(String name) {
        switch (name) {
            case "Dynamic": return DYNAMIC;
            case "Void":    return VOID;
            case "Int":     return INT;
            case "Float":   return FLOAT;
            case "Bool":    return BOOL;
            case "String":  return STRING;
            default:        return new TypeRef(name);
        }
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getParams() {
        return params;
    }

    public boolean isArray() {
        return "Array".equals(name);
    }

    public boolean isMap() {
        return "Map".equals(name) || name.endsWith("Map");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRef)) return false;
        TypeRef other = (TypeRef) o;
        return name.equals(other.name) && params.equals(other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, params);
    }

    @Override
    public String toString() {
        if (params.isEmpty()) return name;
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i));
        }
        return sb.append('>').toString();
    }
}
