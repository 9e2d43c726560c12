package com.exforge.ir.ast.control;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.pattern.ElixirPattern;

/**
 * pattern [when guard] -> body。用于 case、receive、try 的 else 以及 with 的 else。
 */
public final class ECaseClause {
    private final ElixirPattern pattern;
    private final ElixirNode guard;
    private final ElixirNode body;

    public ECaseClause(ElixirPattern pattern, ElixirNode guard, ElixirNode body) {
        this.pattern = pattern;
        this.guard = guard;
        this.body = body;
    }

    public ECaseClause(ElixirPattern pattern, ElixirNode body) {
        this(pattern, null, body);
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

    public ECaseClause withPattern(ElixirPattern newPattern) {
        return newPattern == pattern ? this : new ECaseClause(newPattern, guard, body);
    }

    public ECaseClause withBody(ElixirNode newBody) {
        return newBody == body ? this : new ECaseClause(pattern, guard, newBody);
    }
}
