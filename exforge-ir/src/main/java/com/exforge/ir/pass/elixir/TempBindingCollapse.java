package com.exforge.ir.pass.elixir;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.Nodes;
import com.exforge.ir.ast.VarUsage;
import com.exforge.ir.ast.data.*;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.List;

/**
 * 临时绑定折叠：表达式位置上的两语句块 {@code tmp = A; B} 折叠为 {@code B[tmp := (A)]}。
 * <p>
 * 只在父节点是表达式位置时触发（map/struct/list/tuple 元素、调用参数、二元操作数、括号、匹配右侧）。
 * 子句体、函数体、if 分支和块语句保持原样。tmp 必须在 B 中出现，且只出现一次，
 * 或 A 本身可以无代价重复求值；否则不折叠。
 */
public class TempBindingCollapse extends ElixirTransformer implements ElixirPass {

    public static final String NAME = "temp-binding-collapse";

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
        if (node instanceof EList) {
            EList list = (EList) node;
            List<ElixirNode> elements = collapseAll(list.getElements());
            return elements == list.getElements() ? node
                    : rebuilt(node, new EList(node.getLocation(), elements));
        }
        if (node instanceof ETuple) {
            ETuple tuple = (ETuple) node;
            List<ElixirNode> elements = collapseAll(tuple.getElements());
            return elements == tuple.getElements() ? node
                    : rebuilt(node, new ETuple(node.getLocation(), elements));
        }
        if (node instanceof EMap) {
            return collapseMap((EMap) node);
        }
        if (node instanceof EStruct) {
            EStruct struct = (EStruct) node;
            List<EKeywordPair> fields = collapsePairs(struct.getFields());
            return fields == struct.getFields() ? node
                    : rebuilt(node, new EStruct(node.getLocation(), struct.getModule(), struct.getBase(), fields));
        }
        if (node instanceof EKeywordList) {
            EKeywordList kw = (EKeywordList) node;
            List<EKeywordPair> pairs = collapsePairs(kw.getPairs());
            return pairs == kw.getPairs() ? node : rebuilt(node, new EKeywordList(node.getLocation(), pairs));
        }
        if (node instanceof ECall) {
            ECall call = (ECall) node;
            List<ElixirNode> args = collapseAll(call.getArgs());
            return args == call.getArgs() ? node
                    : rebuilt(node, new ECall(node.getLocation(), call.getName(), args));
        }
        if (node instanceof ERemoteCall) {
            ERemoteCall call = (ERemoteCall) node;
            List<ElixirNode> args = collapseAll(call.getArgs());
            return args == call.getArgs() ? node
                    : rebuilt(node, new ERemoteCall(node.getLocation(), call.getModule(), call.getFunction(), args));
        }
        if (node instanceof EApply) {
            EApply apply = (EApply) node;
            List<ElixirNode> args = collapseAll(apply.getArgs());
            return args == apply.getArgs() ? node
                    : rebuilt(node, new EApply(node.getLocation(), apply.getFunction(), args));
        }
        if (node instanceof EBinary) {
            EBinary bin = (EBinary) node;
            ElixirNode left = collapse(bin.getLeft());
            ElixirNode right = collapse(bin.getRight());
            return left == bin.getLeft() && right == bin.getRight() ? node
                    : rebuilt(node, new EBinary(node.getLocation(), bin.getOperator(), left, right));
        }
        if (node instanceof EParen) {
            ElixirNode inner = collapse(((EParen) node).getExpr());
            return inner == ((EParen) node).getExpr() ? node : rebuilt(node, new EParen(node.getLocation(), inner));
        }
        if (node instanceof EMatch) {
            EMatch match = (EMatch) node;
            ElixirNode value = collapse(match.getValue());
            return value == match.getValue() ? node
                    : rebuilt(node, new EMatch(node.getLocation(), match.getPattern(), value));
        }
        return node;
    }

    private List<ElixirNode> collapseAll(List<ElixirNode> nodes) {
        List<ElixirNode> result = null;
        for (int i = 0; i < nodes.size(); i++) {
            ElixirNode updated = collapse(nodes.get(i));
            if (updated != nodes.get(i) && result == null) {
                result = new ArrayList<>(nodes.subList(0, i));
            }
            if (result != null) result.add(updated);
        }
        return result != null ? result : nodes;
    }

    private List<EKeywordPair> collapsePairs(List<EKeywordPair> pairs) {
        boolean changed = false;
        List<EKeywordPair> result = new ArrayList<>();
        for (EKeywordPair pair : pairs) {
            ElixirNode value = collapse(pair.getValue());
            if (value != pair.getValue()) changed = true;
            result.add(value == pair.getValue() ? pair : new EKeywordPair(pair.getKey(), value));
        }
        return changed ? result : pairs;
    }

    private ElixirNode collapseMap(EMap map) {
        boolean changed = false;
        List<EMapEntry> entries = new ArrayList<>();
        for (EMapEntry entry : map.getEntries()) {
            ElixirNode value = collapse(entry.getValue());
            if (value != entry.getValue()) changed = true;
            entries.add(value == entry.getValue() ? entry : new EMapEntry(entry.getKey(), value));
        }
        return changed ? rebuilt(map, new EMap(map.getLocation(), map.getBase(), entries)) : map;
    }

    /**
     * 尝试折叠单个表达式槽位；条件不满足时原样返回。
     */
    ElixirNode collapse(ElixirNode slot) {
        if (!(slot instanceof EBlock)) return slot;
        EBlock block = (EBlock) slot;
        if (block.size() != 2) return slot;
        String tmp = Nodes.boundName(block.getStatements().get(0));
        if (tmp == null) return slot;
        ElixirNode init = ((EMatch) block.getStatements().get(0)).getValue();
        ElixirNode body = block.getStatements().get(1);

        int reads = VarUsage.countReads(body, tmp);
        if (reads == 0) return slot;
        if (reads > 1 && !VarUsage.isTrivial(init)) return slot;
        if (VarUsage.reads(init, tmp)) return slot;
        // 体内重新绑定 tmp 时替换不再是同一个值
        if (VarUsage.binds(body, tmp)) return slot;

        ElixirNode replacement = VarUsage.isTrivial(init) ? init : new EParen(init.getLocation(), init);
        return ElixirTransformer.rewrite(body, n -> Nodes.isVar(n, tmp) ? replacement : n);
    }
}
