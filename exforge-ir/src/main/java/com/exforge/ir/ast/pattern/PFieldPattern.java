package com.exforge.ir.ast.pattern;

/**
 * 结构体模式字段 field: pattern
 */
public final class PFieldPattern {
    private final String field;
    private final ElixirPattern pattern;

    public PFieldPattern(String field, ElixirPattern pattern) {
        this.field = field;
        this.pattern = pattern;
    }

    public String getField() {
        return field;
    }

    public ElixirPattern getPattern() {
        return pattern;
    }
}
