package com.exforge.ir.ast.expr;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.pattern.ElixirPattern;

/**
 * 推导式生成器 pattern <- source
 */
public final class EForGenerator {
    private final ElixirPattern pattern;
    private final ElixirNode source;

    public EForGenerator(ElixirPattern pattern, ElixirNode source) {
        this.pattern = pattern;
        this.source = source;
    }

    public ElixirPattern getPattern() {
        return pattern;
    }

    public ElixirNode getSource() {
        return source;
    }
}
