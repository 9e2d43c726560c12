package com.exforge.ir.ast.control;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.pattern.ElixirPattern;

/**
 * with 子句：pattern <- value
 */
public final class EWithClause {
    private final ElixirPattern pattern;
    private final ElixirNode value;

    public EWithClause(ElixirPattern pattern, ElixirNode value) {
        this.pattern = pattern;
        this.value = value;
    }

    public ElixirPattern getPattern() {
        return pattern;
    }

    public ElixirNode getValue() {
        return value;
    }
}
