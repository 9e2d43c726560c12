package com.exforge.ir.ast.control;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.pattern.ElixirPattern;

/**
 * catch 分支：[kind,] pattern [when guard] -> body
 */
public final class ECatchClause {
    private final ElixirPattern kind;
    private final ElixirPattern pattern;
    private final ElixirNode guard;
    private final ElixirNode body;

    public ECatchClause(ElixirPattern kind, ElixirPattern pattern, ElixirNode guard, ElixirNode body) {
        this.kind = kind;
        this.pattern = pattern;
        this.guard = guard;
        this.body = body;
    }

    /** :throw / :exit / :error，可为 null */
    public ElixirPattern getKind() {
        return kind;
    }

    public ElixirPattern getPattern() {
        return pattern;
    }

    public ElixirNode getGuard() {
        return guard;
    }

    public ElixirNode getBody() {
        return body;
    }
}
