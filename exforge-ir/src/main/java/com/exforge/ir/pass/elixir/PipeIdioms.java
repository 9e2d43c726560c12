package com.exforge.ir.pass.elixir;

import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.VarUsage;
import com.exforge.ir.ast.expr.EAlias;
import com.exforge.ir.ast.expr.EBinary;
import com.exforge.ir.ast.expr.ERemoteCall;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

/**
 * 嵌套调用链改写为管道。
 * <p>
 * {@code Enum.map(Enum.filter(xs, f), g)} 改写为 {@code xs |> Enum.filter(f) |> Enum.map(g)}。
 * 至少两层模块调用、每层的第一个参数是下一层调用，最内层的第一个参数必须是平凡表达式。
 * 单层调用不改写。
 */
public class PipeIdioms extends ElixirTransformer implements ElixirPass {

    public static final String NAME = "pipe-idioms";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ElixirNode run(ElixirNode root, PassContext context) {
        return transform(root);
    }

    @Override
    protected ElixirNode rewriteNode(ElixirNode node) {
        if (!isAliasCall(node)) return node;
        ERemoteCall outer = (ERemoteCall) node;
        ElixirNode first = outer.getArgs().get(0);

        // 内层已经改写成管道：接到管道末尾
        if (first instanceof EBinary && ((EBinary) first).getOperator() == BinaryOp.PIPE) {
            return pipe(node, first, outer);
        }
        if (!isAliasCall(first)) return node;
        ERemoteCall inner = (ERemoteCall) first;
        ElixirNode source = inner.getArgs().get(0);
        if (!VarUsage.isTrivial(source)) return node;
        ElixirNode head = new EBinary(inner.getLocation(), BinaryOp.PIPE, source, dropFirst(inner))
                .withMetadataFrom(inner);
        return pipe(node, head, outer);
    }

    private static ElixirNode pipe(ElixirNode original, ElixirNode left, ERemoteCall call) {
        return rebuilt(original, new EBinary(call.getLocation(), BinaryOp.PIPE, left, dropFirst(call)));
    }

    /** 模块为别名且至少有一个参数的调用 */
    private static boolean isAliasCall(ElixirNode node) {
        if (!(node instanceof ERemoteCall)) return false;
        ERemoteCall call = (ERemoteCall) node;
        return call.getModule() instanceof EAlias && !call.getArgs().isEmpty();
    }

    private static ERemoteCall dropFirst(ERemoteCall call) {
        return new ERemoteCall(call.getLocation(), call.getModule(), call.getFunction(),
                call.getArgs().subList(1, call.getArgs().size()));
    }
}
