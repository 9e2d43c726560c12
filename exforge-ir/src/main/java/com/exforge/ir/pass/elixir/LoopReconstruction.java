package com.exforge.ir.pass.elixir;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.Nodes;
import com.exforge.ir.ast.StructuralEquality;
import com.exforge.ir.ast.VarUsage;
import com.exforge.ir.ast.data.EList;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.PVar;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 循环/推导式重建。
 * <p>
 * 只处理带 {@link Metadata#UNROLLED_LOOP} 标记的块，形状为：
 * <pre>
 *   g = []
 *   g = g ++ [e0]
 *   ...
 *   g = g ++ [eN-1]
 *   g
 * </pre>
 * 若存在模板 T 使每个 ek 等于 T 中索引变量替换为 k 的结果，改写为 {@code for i <- 0..N-1, do: T}。
 * 模板本身是列表时再尝试重建一层内层推导式，失败则保留列表体。无法统一时块保持不变。
 */
public class LoopReconstruction extends ElixirTransformer implements ElixirPass {

    public static final String NAME = "loop-reconstruction";

    /** 模板中可参与索引替换的整数字面量数上限 */
    private static final int MAX_INDEX_SITES = 10;

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
        if (!(node instanceof EBlock) || !node.hasFlag(Metadata.UNROLLED_LOOP)) return node;
        EBlock block = (EBlock) node;
        List<ElixirNode> elements = unrolledElements(block);
        if (elements == null || elements.size() < 2) return node;

        String index = indexName(elements, "i");
        ElixirNode template = unify(elements, index);
        if (template == null) return node;

        ElixirNode body = template;
        if (template instanceof EList) {
            ElixirNode inner = reconstructInner((EList) template, index);
            if (inner != null) body = inner;
        }
        SourceLocation loc = node.getLocation();
        return new EFor(loc, Collections.singletonList(new EForGenerator(new PVar(loc, index), range(loc, elements.size()))),
                Collections.<ElixirNode>emptyList(), null, body)
                .withMetadata(block.getMetadata().without(Metadata.UNROLLED_LOOP));
    }

    /**
     * 提取展开循环追加的元素；形状不符返回 null。
     */
    static List<ElixirNode> unrolledElements(EBlock block) {
        List<ElixirNode> stmts = block.getStatements();
        if (stmts.size() < 3) return null;
        String acc = Nodes.boundName(stmts.get(0));
        if (acc == null) return null;
        ElixirNode init = ((EMatch) stmts.get(0)).getValue();
        if (!(init instanceof EList) || !((EList) init).getElements().isEmpty()) return null;
        if (!Nodes.isVar(stmts.get(stmts.size() - 1), acc)) return null;

        List<ElixirNode> elements = new ArrayList<>();
        for (int i = 1; i < stmts.size() - 1; i++) {
            if (!acc.equals(Nodes.boundName(stmts.get(i)))) return null;
            ElixirNode value = ((EMatch) stmts.get(i)).getValue();
            if (!(value instanceof EBinary)) return null;
            EBinary concat = (EBinary) value;
            if (concat.getOperator() != BinaryOp.CONCAT || !Nodes.isVar(concat.getLeft(), acc)) return null;
            if (!(concat.getRight() instanceof EList)) return null;
            List<ElixirNode> appended = ((EList) concat.getRight()).getElements();
            if (appended.size() != 1) return null;
            ElixirNode element = appended.get(0);
            if (VarUsage.reads(element, acc)) return null;
            elements.add(element);
        }
        return elements;
    }

    /**
     * 寻找模板：e0 中值为 0 的整数字面量的某个子集替换为索引变量后，
     * 对每个 k 代入 k 都与 ek 一致。
     */
    private static ElixirNode unify(List<ElixirNode> elements, String index) {
        ElixirNode first = elements.get(0);
        int sites = countZeroSites(first);
        if (sites > MAX_INDEX_SITES) return null;
        for (int mask = 0; mask < (1 << sites); mask++) {
            ElixirNode template = abstractSites(first, mask, index);
            if (matchesAll(template, elements, index)) return template;
        }
        return null;
    }

    private static boolean matchesAll(ElixirNode template, List<ElixirNode> expected, String index) {
        for (int k = 0; k < expected.size(); k++) {
            if (!StructuralEquality.equal(instantiate(template, index, k), expected.get(k))) return false;
        }
        return true;
    }

    /** 一层内层重建：列表元素能统一为 j 的模板时返回内层推导式 */
    private static ElixirNode reconstructInner(EList list, String outerIndex) {
        List<ElixirNode> elements = list.getElements();
        if (elements.size() < 2) return null;
        String inner = indexName(elements, outerIndex.equals("j") ? "k" : "j");
        if (inner.equals(outerIndex)) return null;
        ElixirNode template = unify(elements, inner);
        if (template == null || !VarUsage.reads(template, inner)) return null;
        SourceLocation loc = list.getLocation();
        return new EFor(loc, Collections.singletonList(new EForGenerator(new PVar(loc, inner), range(loc, elements.size()))),
                Collections.<ElixirNode>emptyList(), null, template);
    }

    private static ERange range(SourceLocation loc, int count) {
        return new ERange(loc, ELiteral.ofInt(0), ELiteral.ofInt(count - 1), null);
    }

    /** 选一个元素里没有出现过的索引变量名 */
    private static String indexName(List<ElixirNode> elements, String preferred) {
        String candidate = preferred;
        int suffix = 0;
        while (mentionedIn(elements, candidate)) {
            candidate = preferred + (++suffix);
        }
        return candidate;
    }

    private static boolean mentionedIn(List<ElixirNode> elements, String name) {
        for (ElixirNode element : elements) {
            if (VarUsage.mentions(element, name)) return true;
        }
        return false;
    }

    private static boolean isZero(ElixirNode node) {
        return Nodes.isIntLiteral(node, 0);
    }

    private static int countZeroSites(ElixirNode node) {
        int[] count = {0};
        ElixirTransformer.rewrite(node, n -> {
            if (isZero(n)) count[0]++;
            return n;
        });
        return count[0];
    }

    /** 把第 i 个（遍历顺序）值为 0 的字面量在 mask 第 i 位为 1 时替换为索引变量 */
    private static ElixirNode abstractSites(ElixirNode node, int mask, String index) {
        int[] site = {0};
        return ElixirTransformer.rewrite(node, n -> {
            if (!isZero(n)) return n;
            int current = site[0]++;
            return (mask & (1 << current)) != 0 ? new EVar(n.getLocation(), index) : n;
        });
    }

    private static ElixirNode instantiate(ElixirNode template, String index, long value) {
        return ElixirTransformer.rewrite(template,
                n -> Nodes.isVar(n, index) ? ELiteral.ofInt(value) : n);
    }
}
