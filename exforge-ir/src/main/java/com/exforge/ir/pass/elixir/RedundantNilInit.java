package com.exforge.ir.pass.elixir;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.Nodes;
import com.exforge.ir.ast.VarUsage;
import com.exforge.ir.ast.expr.EBlock;
import com.exforge.ir.ast.expr.EMatch;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.List;

/**
 * 删除多余的 nil 初始化。
 * <p>
 * 块中的 {@code x = nil} 之后（中间可以有无关语句）出现不读取 x 的 {@code x = <非 nil>} 时删除该初始化。
 * 又一条 {@code x = nil} 不终止查找；在重新赋值之前读取 x，或在复合语句内部出现 x，则保留。
 */
public class RedundantNilInit extends ElixirTransformer implements ElixirPass {

    public static final String NAME = "redundant-nil-init";

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
        if (!(node instanceof EBlock)) return node;
        EBlock block = (EBlock) node;
        List<ElixirNode> stmts = block.getStatements();
        List<ElixirNode> kept = new ArrayList<>(stmts.size());
        for (int i = 0; i < stmts.size(); i++) {
            ElixirNode stmt = stmts.get(i);
            String name = nilInitName(stmt);
            if (name != null && i < stmts.size() - 1 && isOverwritten(stmts, i + 1, name)) {
                continue;
            }
            kept.add(stmt);
        }
        if (kept.size() == stmts.size()) return node;
        return rebuilt(node, new EBlock(node.getLocation(), kept));
    }

    private static String nilInitName(ElixirNode stmt) {
        String name = Nodes.boundName(stmt);
        if (name != null && Nodes.isNil(((EMatch) stmt).getValue())) return name;
        return null;
    }

    /**
     * 从 start 起向后查找：是否在读取 name 之前被重新赋为非 nil 值。
     */
    static boolean isOverwritten(List<ElixirNode> stmts, int start, String name) {
        for (int j = start; j < stmts.size(); j++) {
            ElixirNode stmt = stmts.get(j);
            if (name.equals(nilInitName(stmt))) {
                continue;
            }
            if (name.equals(Nodes.boundName(stmt))) {
                return !VarUsage.reads(((EMatch) stmt).getValue(), name);
            }
            if (VarUsage.mentions(stmt, name)) {
                return false;
            }
        }
        return false;
    }
}
