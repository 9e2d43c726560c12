package com.exforge.ir.pass;

/**
 * 单个编译单元的 pass 执行上下文
 */
public class PassContext {

    private final FreshNameGenerator names;

    public PassContext(FreshNameGenerator names) {
        this.names = names;
    }

    public PassContext() {
        this(new FreshNameGenerator());
    }

    public FreshNameGenerator getNames() {
        return names;
    }

    public String freshName(String prefix) {
        return names.fresh(prefix);
    }
}
