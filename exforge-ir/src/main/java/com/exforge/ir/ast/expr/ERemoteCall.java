package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * 模块限定调用 Module.fun(args)。module 可以是别名、原子或变量/字段（接收者调用）。
 */
public class ERemoteCall extends ElixirNode {
    private final ElixirNode module;
    private final String function;
    private final List<ElixirNode> args;

    public ERemoteCall(SourceLocation location, ElixirNode module, String function, List<ElixirNode> args) {
        super(location);
        this.module = module;
        this.function = function;
        this.args = args;
    }

    public ElixirNode getModule() {
        return module;
    }

    public String getFunction() {
        return function;
    }

    public List<ElixirNode> getArgs() {
        return args;
    }

    /** 模块是否为给定别名 */
    public boolean isOn(String alias) {
        return module instanceof EAlias && ((EAlias) module).getName().equals(alias);
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitRemoteCall(this, context);
    }
}
