package com.exforge.ir.pass.elixir;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.Nodes;
import com.exforge.ir.ast.UnaryOp;
import com.exforge.ir.ast.control.EIf;
import com.exforge.ir.ast.control.EWhileLoop;
import com.exforge.ir.ast.data.EList;
import com.exforge.ir.ast.data.EMap;
import com.exforge.ir.ast.data.EMapEntry;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.PVar;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 可变 → 不可变降级。
 * <ul>
 *   <li>{@code x = v}、{@code x op= v} → 重新绑定</li>
 *   <li>{@code struct.f = v} → {@code struct = %{struct | f: v}}</li>
 *   <li>{@code a[i] = v} → {@code a = List.replace_at(a, i, v)}，复合赋值读取 {@code Enum.at(a, i)}</li>
 *   <li>带 {@link Metadata#MAP_ACCESS} 的 {@code m[k] = v} → {@code m = Map.put(m, k, v)}</li>
 *   <li>语句位置的 {@code a.push(v)} / {@code a.pop()} → 列表拼接 / {@code List.delete_at}</li>
 *   <li>自增/自减 → 重新绑定</li>
 * </ul>
 * 字段更新要求接收者是约定的实例参数 {@value #INSTANCE_PARAM}，其他接收者保持原样。
 */
public class MutableToImmutable extends ElixirTransformer implements ElixirPass {

    public static final String NAME = "mutable-to-immutable";

    /** 实例方法的接收者参数名 */
    public static final String INSTANCE_PARAM = "struct";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ElixirNode run(ElixirNode root, PassContext context) {
        return transform(root);
    }

    @Override
    public ElixirNode visitBlock(EBlock node, Void ctx) {
        List<ElixirNode> stmts = transformList(node.getStatements());
        List<ElixirNode> lowered = lowerStatements(stmts);
        ElixirNode result = lowered == node.getStatements() ? node
                : rebuilt(node, new EBlock(node.getLocation(), lowered));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitWhileLoop(EWhileLoop node, Void ctx) {
        ElixirNode cond = transform(node.getCondition());
        ElixirNode body = lowerStatement(transform(node.getBody()));
        ElixirNode result = cond == node.getCondition() && body == node.getBody() ? node
                : rebuilt(node, new EWhileLoop(node.getLocation(), cond, body));
        return rewriteNode(result);
    }

    @Override
    protected ElixirNode rewriteNode(ElixirNode node) {
        if (node instanceof EAssign) {
            return lowerAssign((EAssign) node);
        }
        if (node instanceof EUnary) {
            EUnary unary = (EUnary) node;
            // 前置自增的值就是新值，可在任意位置改写
            if (unary.getOperator() == UnaryOp.PRE_INCREMENT || unary.getOperator() == UnaryOp.PRE_DECREMENT) {
                return lowerStatement(node);
            }
        }
        if (node instanceof EIf) {
            EIf branchy = (EIf) node;
            ElixirNode then = lowerStatement(branchy.getThenBranch());
            ElixirNode els = lowerStatement(branchy.getElseBranch());
            if (then != branchy.getThenBranch() || els != branchy.getElseBranch()) {
                return rebuilt(node, new EIf(node.getLocation(), branchy.getCondition(), then, els));
            }
        }
        return node;
    }

    private List<ElixirNode> lowerStatements(List<ElixirNode> stmts) {
        List<ElixirNode> result = null;
        for (int i = 0; i < stmts.size(); i++) {
            ElixirNode updated = lowerStatement(stmts.get(i));
            if (updated != stmts.get(i) && result == null) {
                result = new ArrayList<>(stmts.subList(0, i));
            }
            if (result != null) result.add(updated);
        }
        return result != null ? result : stmts;
    }

    /**
     * 语句位置的变更惯用法；不认识的语句原样返回。
     */
    ElixirNode lowerStatement(ElixirNode stmt) {
        if (stmt instanceof ERemoteCall) {
            ERemoteCall call = (ERemoteCall) stmt;
            ElixirNode receiver = call.getModule();
            if ("push".equals(call.getFunction()) && call.getArgs().size() == 1) {
                return updateReceiver(stmt, receiver, current -> new EBinary(stmt.getLocation(), BinaryOp.CONCAT,
                        current, new EList(stmt.getLocation(), Collections.singletonList(call.getArgs().get(0)))));
            }
            if ("pop".equals(call.getFunction()) && call.getArgs().isEmpty()) {
                return updateReceiver(stmt, receiver, current -> new ERemoteCall(stmt.getLocation(),
                        Nodes.alias("List"), "delete_at", listOf(current, ELiteral.ofInt(-1))));
            }
            return stmt;
        }
        if (stmt instanceof EUnary) {
            EUnary unary = (EUnary) stmt;
            if (!unary.getOperator().isMutating()) return stmt;
            BinaryOp op = unary.getOperator().isIncrement() ? BinaryOp.ADD : BinaryOp.SUB;
            return updateReceiver(stmt, unary.getOperand(),
                    current -> new EBinary(stmt.getLocation(), op, current, ELiteral.ofInt(1)));
        }
        return stmt;
    }

    private ElixirNode lowerAssign(EAssign assign) {
        return updateReceiver(assign, assign.getTarget(), current -> combine(assign, current));
    }

    /** 复合赋值展开为 current op value */
    private static ElixirNode combine(EAssign assign, ElixirNode current) {
        if (assign.getOperator() == null) return assign.getValue();
        return new EBinary(assign.getLocation(), assign.getOperator(), current, assign.getValue());
    }

    /**
     * 把对 receiver 的变更改写为重新绑定：变量直接重新绑定，实例参数的字段改为 map 更新。
     * 其他接收者无法确定如何改写，返回原节点。
     */
    private ElixirNode updateReceiver(ElixirNode original, ElixirNode receiver,
                                      UnaryOperator<ElixirNode> newValue) {
        if (receiver instanceof EVar) {
            return rebind(original, (EVar) receiver, newValue.apply(receiver));
        }
        if (receiver instanceof EField && Nodes.isVar(((EField) receiver).getTarget(), INSTANCE_PARAM)) {
            EField field = (EField) receiver;
            EVar instance = (EVar) field.getTarget();
            SourceLocation loc = original.getLocation();
            EMap update = new EMap(loc, instance, Collections.singletonList(
                    new EMapEntry(new EAtom(loc, field.getField()), newValue.apply(field))));
            return rebind(original, instance, update);
        }
        if (receiver instanceof EAccess && ((EAccess) receiver).getTarget() instanceof EVar) {
            EAccess access = (EAccess) receiver;
            EVar collection = (EVar) access.getTarget();
            SourceLocation loc = original.getLocation();
            if (access.hasFlag(Metadata.MAP_ACCESS)) {
                return rebind(original, collection,
                        remote(loc, "Map", "put", collection, access.getKey(), newValue.apply(access)));
            }
            ElixirNode current = remote(loc, "Enum", "at", collection, access.getKey());
            return rebind(original, collection,
                    remote(loc, "List", "replace_at", collection, access.getKey(), newValue.apply(current)));
        }
        return original;
    }

    private static ERemoteCall remote(SourceLocation loc, String module, String function, ElixirNode... args) {
        return new ERemoteCall(loc, Nodes.alias(module), function, listOf(args));
    }

    private static ElixirNode rebind(ElixirNode original, EVar var, ElixirNode value) {
        return new EMatch(original.getLocation(), new PVar(var.getLocation(), var.getName(), var.getSourceId()), value)
                .withMetadataFrom(original);
    }

    private static List<ElixirNode> listOf(ElixirNode... nodes) {
        List<ElixirNode> list = new ArrayList<>();
        Collections.addAll(list, nodes);
        return list;
    }
}
