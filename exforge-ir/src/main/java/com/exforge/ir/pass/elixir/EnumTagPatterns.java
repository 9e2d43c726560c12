package com.exforge.ir.pass.elixir;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.Nodes;
import com.exforge.ir.ast.VarUsage;
import com.exforge.ir.ast.control.ECase;
import com.exforge.ir.ast.control.ECaseClause;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.*;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 枚举标签模式重建。
 * <p>
 * {@code case elem(x, 0) do 1 -> v = elem(x, 1); ... end} 改写为
 * {@code case x do {1, v} -> ... end}：整数字面量子句变成元组模式，子句体中的载荷提取语句移入模式。
 * 元组元数取自 {@link Metadata#ENUM_ARITIES}，缺省时为最大提取下标 + 1，未提取的位置用通配。
 * 非整数字面量子句保持不变；若这样的子句绑定并使用了标签值，整个 case 不改写。
 */
public class EnumTagPatterns extends ElixirTransformer implements ElixirPass {

    public static final String NAME = "enum-tag-patterns";

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
        if (!(node instanceof ECase)) return node;
        ECase match = (ECase) node;
        ElixirNode tagged = tagSubject(match.getSubject());
        if (!(tagged instanceof EVar)) return node;
        String subject = ((EVar) tagged).getName();

        boolean anyInteger = false;
        for (ECaseClause clause : match.getClauses()) {
            if (integerTag(clause.getPattern()) != null) {
                anyInteger = true;
            } else if (bindsUsedTag(clause)) {
                return node;
            }
        }
        if (!anyInteger) return node;

        Map<Long, Integer> arities = match.meta(Metadata.ENUM_ARITIES);
        List<ECaseClause> clauses = new ArrayList<>();
        for (ECaseClause clause : match.getClauses()) {
            Long tag = integerTag(clause.getPattern());
            if (tag == null) {
                clauses.add(clause);
                continue;
            }
            ECaseClause rewritten = rewriteClause(clause, tag, subject, arities);
            if (rewritten == null) return node;
            clauses.add(rewritten);
        }
        return rebuilt(node, new ECase(node.getLocation(), tagged, clauses));
    }

    /** elem(x, 0) 或 Kernel.elem(x, 0) 时返回 x，否则 null */
    static ElixirNode tagSubject(ElixirNode subject) {
        List<ElixirNode> args = elemArgs(subject);
        if (args == null || !Nodes.isIntLiteral(args.get(1), 0)) return null;
        return args.get(0);
    }

    private static List<ElixirNode> elemArgs(ElixirNode node) {
        if (node instanceof ECall) {
            ECall call = (ECall) node;
            if ("elem".equals(call.getName()) && call.getArgs().size() == 2) return call.getArgs();
        }
        if (node instanceof ERemoteCall) {
            ERemoteCall call = (ERemoteCall) node;
            if (call.isOn("Kernel") && "elem".equals(call.getFunction()) && call.getArgs().size() == 2) {
                return call.getArgs();
            }
        }
        return null;
    }

    private static Long integerTag(ElixirPattern pattern) {
        if (!(pattern instanceof PLiteral)) return null;
        ElixirNode value = ((PLiteral) pattern).getValue();
        if (value instanceof ELiteral && ((ELiteral) value).isInteger()) return ((ELiteral) value).asLong();
        return null;
    }

    private static boolean bindsUsedTag(ECaseClause clause) {
        if (!(clause.getPattern() instanceof PVar)) return false;
        String name = ((PVar) clause.getPattern()).getName();
        return VarUsage.reads(clause.getBody(), name) || VarUsage.reads(clause.getGuard(), name);
    }

    /**
     * 改写单个整数子句；同一下标被提取到不同名字时返回 null。
     */
    private static ECaseClause rewriteClause(ECaseClause clause, long tag, String subject, Map<Long, Integer> arities) {
        SourceLocation loc = clause.getPattern().getLocation();
        Map<Integer, PVar> extracted = new TreeMap<>();
        List<ElixirNode> remaining = new ArrayList<>();
        for (ElixirNode stmt : Nodes.statementsOf(clause.getBody())) {
            Integer index = payloadIndex(stmt, subject);
            if (index == null) {
                remaining.add(stmt);
                continue;
            }
            PVar var = (PVar) ((EMatch) stmt).getPattern();
            PVar previous = extracted.get(index);
            if (previous != null && !previous.getName().equals(var.getName())) return null;
            extracted.put(index, var);
        }

        int arity = 1;
        for (int index : extracted.keySet()) arity = Math.max(arity, index + 1);
        if (arities != null && arities.containsKey(tag)) arity = Math.max(arity, arities.get(tag));

        List<ElixirPattern> elements = new ArrayList<>(arity);
        elements.add(new PLiteral(loc, ELiteral.ofInt(tag)));
        for (int i = 1; i < arity; i++) {
            PVar var = extracted.get(i);
            elements.add(var != null ? var : new PWildcard(loc));
        }
        ElixirNode body = remaining.isEmpty()
                ? new ENil(clause.getBody().getLocation())
                : Nodes.bodyOf(clause.getBody().getLocation(), remaining);
        return new ECaseClause(new PTuple(loc, elements), clause.getGuard(), body);
    }

    /** 形如 v = elem(subject, k)（k ≥ 1）时返回 k */
    private static Integer payloadIndex(ElixirNode stmt, String subject) {
        if (Nodes.boundName(stmt) == null) return null;
        List<ElixirNode> args = elemArgs(((EMatch) stmt).getValue());
        if (args == null || !Nodes.isVar(args.get(0), subject)) return null;
        ElixirNode index = args.get(1);
        if (!(index instanceof ELiteral) || !((ELiteral) index).isInteger()) return null;
        long k = ((ELiteral) index).asLong();
        if (k < 1 || k > Integer.MAX_VALUE) return null;
        return (int) k;
    }
}
