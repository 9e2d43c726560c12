package com.exforge.ir.ast.expr;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.pattern.ElixirPattern;

import java.util.List;

/**
 * 匿名函数子句 params [when guard] -> body
 */
public final class EFnClause {
    private final List<ElixirPattern> params;
    private final ElixirNode guard;
    private final ElixirNode body;

    public EFnClause(List<ElixirPattern> params, ElixirNode guard, ElixirNode body) {
        this.params = params;
        this.guard = guard;
        this.body = body;
    }

    public List<ElixirPattern> getParams() {
        return params;
    }

    public ElixirNode getGuard() {
        return guard;
    }

    public ElixirNode getBody() {
        return body;
    }
}
