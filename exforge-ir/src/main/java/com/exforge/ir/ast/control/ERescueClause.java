package com.exforge.ir.ast.control;

import com.exforge.ir.ast.ElixirNode;

import java.util.List;

/**
 * rescue 分支：[var in] Mod1, Mod2 -> body。variable 为 null 且模块为空时即 rescue _ 。
 */
public final class ERescueClause {
    private final String variable;
    private final List<String> exceptionModules;
    private final ElixirNode body;

    public ERescueClause(String variable, List<String> exceptionModules, ElixirNode body) {
        this.variable = variable;
        this.exceptionModules = exceptionModules;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public List<String> getExceptionModules() {
        return exceptionModules;
    }

    public ElixirNode getBody() {
        return body;
    }
}
