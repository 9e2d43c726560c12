package com.exforge.compiler.naming;

/**
 * 目标标识符命名回调：把源语言标识符映射为合法的 Elixir 标识符。
 */
public interface IdentifierNaming {

    /** 变量/函数名 */
    String toElixirName(String sourceName);

    /** 模块名（点分路径） */
    String toModuleName(String sourcePath);
}
