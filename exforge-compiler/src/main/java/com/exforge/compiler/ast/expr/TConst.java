package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * 常量：整数、浮点、字符串、布尔、null 与 this
 */
public class TConst extends TypedExpr {
    private final ConstKind kind;
    private final Object value;

    public TConst(SourceLocation location, TypeRef type, ConstKind kind, Object value) {
        super(location, type);
        this.kind = kind;
        this.value = value;
    }

    public static TConst ofInt(long value) {
        return new TConst(SourceLocation.UNKNOWN, TypeRef.INT, ConstKind.INT, value);
    }

    public static TConst ofFloat(double value) {
        return new TConst(SourceLocation.UNKNOWN, TypeRef.FLOAT, ConstKind.FLOAT, value);
    }

    public static TConst ofString(String value) {
        return new TConst(SourceLocation.UNKNOWN, TypeRef.STRING, ConstKind.STRING, value);
    }

    public static TConst ofBool(boolean value) {
        return new TConst(SourceLocation.UNKNOWN, TypeRef.BOOL, ConstKind.BOOL, value);
    }

    public static TConst ofNull() {
        return new TConst(SourceLocation.UNKNOWN, TypeRef.DYNAMIC, ConstKind.NULL, null);
    }

    public static TConst ofThis(TypeRef type) {
        return new TConst(SourceLocation.UNKNOWN, type, ConstKind.THIS, null);
    }

    public ConstKind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return kind == ConstKind.NULL;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitConst(this, context);
    }

    public enum ConstKind {
        INT,
        FLOAT,
        STRING,
        BOOL,
        NULL,
        THIS
    }
}
