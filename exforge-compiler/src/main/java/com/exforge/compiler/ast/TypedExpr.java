package com.exforge.compiler.ast;

import com.exforge.compiler.ast.type.TypeRef;

/**
 * 类型化表达式树节点基类。由上游前端产生，每个节点都携带已解析的类型。
 */
public abstract class TypedExpr {
    protected final SourceLocation location;
    protected final TypeRef type;

    protected TypedExpr(SourceLocation location, TypeRef type) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.type = type != null ? type : TypeRef.DYNAMIC;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public TypeRef getType() {
        return type;
    }

    public abstract <R, C> R accept(TypedVisitor<R, C> visitor, C context);
}
