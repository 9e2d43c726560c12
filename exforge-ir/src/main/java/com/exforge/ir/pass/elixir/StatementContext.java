package com.exforge.ir.pass.elixir;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.control.*;
import com.exforge.ir.ast.decl.EModule;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.PVar;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 语句上下文传播。
 * <p>
 * 值被丢弃（语句位置）的"返回新不可变值"调用，在第一个参数正好是变量 x 时改写为 {@code x = call}。
 * 块中除最后一条外都是语句位置，最后一条继承父节点的上下文；if/case/cond 分支同样继承。
 * 函数体、匿名函数体和推导式体是表达式位置，循环体是语句位置。
 */
public class StatementContext extends ElixirTransformer implements ElixirPass {

    public static final String NAME = "statement-context";

    /** 返回新值而不修改参数的调用 */
    static final Set<String> IMMUTABLE_UPDATES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "Map.put", "Map.delete", "Map.merge", "Map.update", "Map.update!", "Map.put_new", "Map.drop",
            "Keyword.put", "Keyword.delete", "Keyword.merge",
            "List.insert_at", "List.delete_at", "List.replace_at", "List.update_at", "List.delete",
            "MapSet.put", "MapSet.delete",
            "String.replace", "String.trim", "String.upcase", "String.downcase")));

    /** 当前节点的值是否被丢弃 */
    private boolean discarded;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ElixirNode run(ElixirNode root, PassContext context) {
        return transformIn(root, true);
    }

    /** 子节点默认处于表达式位置 */
    @Override
    public ElixirNode transform(ElixirNode node) {
        return transformIn(node, false);
    }

    private ElixirNode transformIn(ElixirNode node, boolean statement) {
        boolean saved = discarded;
        discarded = statement;
        try {
            return super.transform(node);
        } finally {
            discarded = saved;
        }
    }

    @Override
    public ElixirNode visitModule(EModule node, Void ctx) {
        List<ElixirNode> body = transformAll(node.getBody(), true);
        ElixirNode result = body == node.getBody() ? node
                : rebuilt(node, new EModule(node.getLocation(), node.getName(), body));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitBlock(EBlock node, Void ctx) {
        boolean inherited = discarded;
        List<ElixirNode> stmts = node.getStatements();
        List<ElixirNode> result = null;
        for (int i = 0; i < stmts.size(); i++) {
            boolean statement = i < stmts.size() - 1 || inherited;
            ElixirNode updated = transformIn(stmts.get(i), statement);
            if (updated != stmts.get(i) && result == null) {
                result = new ArrayList<>(stmts.subList(0, i));
            }
            if (result != null) result.add(updated);
        }
        ElixirNode rebuiltBlock = result == null ? node : rebuilt(node, new EBlock(node.getLocation(), result));
        return rewriteNode(rebuiltBlock);
    }

    @Override
    public ElixirNode visitIf(EIf node, Void ctx) {
        boolean inherited = discarded;
        ElixirNode cond = transform(node.getCondition());
        ElixirNode then = transformIn(node.getThenBranch(), inherited);
        ElixirNode els = transformIn(node.getElseBranch(), inherited);
        ElixirNode result = cond == node.getCondition() && then == node.getThenBranch() && els == node.getElseBranch()
                ? node
                : rebuilt(node, new EIf(node.getLocation(), cond, then, els));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitCase(ECase node, Void ctx) {
        boolean inherited = discarded;
        ElixirNode subject = transform(node.getSubject());
        boolean changed = subject != node.getSubject();
        List<ECaseClause> clauses = new ArrayList<>();
        for (ECaseClause clause : node.getClauses()) {
            ElixirNode body = transformIn(clause.getBody(), inherited);
            if (body != clause.getBody()) changed = true;
            clauses.add(clause.withBody(body));
        }
        ElixirNode result = changed ? rebuilt(node, new ECase(node.getLocation(), subject, clauses)) : node;
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitCond(ECond node, Void ctx) {
        boolean inherited = discarded;
        boolean changed = false;
        List<ECondClause> clauses = new ArrayList<>();
        for (ECondClause clause : node.getClauses()) {
            ElixirNode cond = transform(clause.getCondition());
            ElixirNode body = transformIn(clause.getBody(), inherited);
            if (cond != clause.getCondition() || body != clause.getBody()) {
                changed = true;
                clauses.add(new ECondClause(cond, body));
            } else {
                clauses.add(clause);
            }
        }
        ElixirNode result = changed ? rebuilt(node, new ECond(node.getLocation(), clauses)) : node;
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitWhileLoop(EWhileLoop node, Void ctx) {
        ElixirNode cond = transform(node.getCondition());
        ElixirNode body = transformIn(node.getBody(), true);
        ElixirNode result = cond == node.getCondition() && body == node.getBody() ? node
                : rebuilt(node, new EWhileLoop(node.getLocation(), cond, body));
        return rewriteNode(result);
    }

    @Override
    protected ElixirNode rewriteNode(ElixirNode node) {
        if (!discarded || !(node instanceof ERemoteCall)) return node;
        ERemoteCall call = (ERemoteCall) node;
        if (!(call.getModule() instanceof EAlias) || call.getArgs().isEmpty()) return node;
        String qualified = ((EAlias) call.getModule()).getName() + "." + call.getFunction();
        if (!IMMUTABLE_UPDATES.contains(qualified)) return node;
        ElixirNode first = call.getArgs().get(0);
        if (!(first instanceof EVar)) return node;
        EVar target = (EVar) first;
        return new EMatch(node.getLocation(),
                new PVar(target.getLocation(), target.getName(), target.getSourceId()), node);
    }

    private List<ElixirNode> transformAll(List<ElixirNode> nodes, boolean statement) {
        List<ElixirNode> result = null;
        for (int i = 0; i < nodes.size(); i++) {
            ElixirNode updated = transformIn(nodes.get(i), statement);
            if (updated != nodes.get(i) && result == null) {
                result = new ArrayList<>(nodes.subList(0, i));
            }
            if (result != null) result.add(updated);
        }
        return result != null ? result : nodes;
    }
}
