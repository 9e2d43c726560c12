package com.exforge.ir.pass.elixir;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.Nodes;
import com.exforge.ir.ast.VarUsage;
import com.exforge.ir.ast.control.EIf;
import com.exforge.ir.ast.expr.EMatch;
import com.exforge.ir.ast.expr.EVar;
import com.exforge.ir.ast.pattern.PVar;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

/**
 * 条件重新赋值：{@code if cond do x = f(x) end}（无 else）改写为
 * {@code x = if cond, do: f(x), else: x}。
 * <p>
 * then 分支必须恰好是一条对 x 的绑定，且右侧引用了 x。
 */
public class ConditionalReassignment extends ElixirTransformer implements ElixirPass {

    public static final String NAME = "conditional-reassignment";

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
        if (!(node instanceof EIf)) return node;
        EIf branch = (EIf) node;
        if (branch.getElseBranch() != null && !Nodes.isNil(branch.getElseBranch())) return node;

        ElixirNode then = Nodes.unwrapSingleton(branch.getThenBranch());
        String name = Nodes.boundName(then);
        if (name == null) return node;
        EMatch assign = (EMatch) then;
        if (!VarUsage.reads(assign.getValue(), name)) return node;

        PVar target = (PVar) assign.getPattern();
        EVar current = new EVar(target.getLocation(), name, target.getSourceId());
        EIf conditional = new EIf(node.getLocation(), branch.getCondition(), assign.getValue(), current);
        return new EMatch(node.getLocation(), target, conditional.withMetadataFrom(node));
    }
}
