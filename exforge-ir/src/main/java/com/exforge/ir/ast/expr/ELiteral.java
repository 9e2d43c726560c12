package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 字面量：整数、浮点、字符串、布尔
 */
public class ELiteral extends ElixirNode {
    private final LiteralKind kind;
    private final Object value;

    public ELiteral(SourceLocation location, LiteralKind kind, Object value) {
        super(location);
        this.kind = kind;
        this.value = value;
    }

    public static ELiteral ofInt(long value) {
        return new ELiteral(SourceLocation.UNKNOWN, LiteralKind.INTEGER, value);
    }

    public static ELiteral ofFloat(double value) {
        return new ELiteral(SourceLocation.UNKNOWN, LiteralKind.FLOAT, value);
    }

    public static ELiteral ofString(String value) {
        return new ELiteral(SourceLocation.UNKNOWN, LiteralKind.STRING, value);
    }

    public static ELiteral ofBoolean(boolean value) {
        return new ELiteral(SourceLocation.UNKNOWN, LiteralKind.BOOLEAN, value);
    }

    public LiteralKind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    public boolean isInteger() {
        return kind == LiteralKind.INTEGER;
    }

    /** 整数字面量的值；非整数时调用属于编程错误 */
    public long asLong() {
        return ((Number) value).longValue();
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public String toString() {
        return "ELiteral(" + value + ")";
    }

    public enum LiteralKind {
        INTEGER,
        FLOAT,
        STRING,
        BOOLEAN
    }
}
