package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * 字段访问：实例字段、静态字段、匿名结构字段或动态字段
 */
public class TField extends TypedExpr {
    private final TypedExpr target;
    private final String name;
    private final FieldKind kind;

    public TField(SourceLocation location, TypeRef type, TypedExpr target, String name, FieldKind kind) {
        super(location, type);
        this.target = target;
        this.name = name;
        this.kind = kind;
    }

    public TField(TypedExpr target, String name, FieldKind kind) {
        this(SourceLocation.UNKNOWN, TypeRef.DYNAMIC, target, name, kind);
    }

    public TField(TypedExpr target, String name) {
        this(target, name, FieldKind.INSTANCE);
    }

    public TypedExpr getTarget() {
        return target;
    }

    public String getName() {
        return name;
    }

    public FieldKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitField(this, context);
    }

    public enum FieldKind {
        INSTANCE,
        STATIC,
        ANON,
        DYNAMIC
    }
}
