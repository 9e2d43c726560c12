package com.exforge.ir.ast.control;

import com.exforge.ir.ast.ElixirNode;

/**
 * cond 分支：condition -> body
 */
public final class ECondClause {
    private final ElixirNode condition;
    private final ElixirNode body;

    public ECondClause(ElixirNode condition, ElixirNode body) {
        this.condition = condition;
        this.body = body;
    }

    public ElixirNode getCondition() {
        return condition;
    }

    public ElixirNode getBody() {
        return body;
    }
}
