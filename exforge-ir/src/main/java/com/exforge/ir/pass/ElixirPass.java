package com.exforge.ir.pass;

import com.exforge.ir.ast.ElixirNode;

/**
 * 中间 AST 变换 pass 接口。
 * <p>
 * pass 是纯函数：只通过构造新节点改写树，不能就地修改。无法确定如何改写的子树原样返回。
 */
public interface ElixirPass {

    /**
     * Pass 名称（用于配置开关和日志）。
     */
    String getName();

    /**
     * 对整棵树执行变换。
     */
    ElixirNode run(ElixirNode root, PassContext context);
}
