package com.exforge.ir.pass;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单调递增的新名字生成器。
 * <p>
 * 每个编译单元一个实例，由 pass 和打印器共享；计数器是原子的，多个单元并行时互不干扰。
 */
public class FreshNameGenerator {

    private final AtomicInteger counter = new AtomicInteger();

    /** 生成 prefix_N，同一生成器内不重复 */
    public String fresh(String prefix) {
        return prefix + "_" + counter.getAndIncrement();
    }

    /** 已分配的名字数 */
    public int issued() {
        return counter.get();
    }
}
