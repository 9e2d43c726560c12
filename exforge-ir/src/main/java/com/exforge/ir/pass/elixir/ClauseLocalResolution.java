package com.exforge.ir.pass.elixir;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirTransformer;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.expr.EVar;
import com.exforge.ir.ast.pattern.ElixirPattern;
import com.exforge.ir.ast.pattern.PVar;
import com.exforge.ir.ast.pattern.PatternTransformer;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassContext;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * 子句局部变量解析。
 * <p>
 * 节点元数据中的 {@link Metadata#CLAUSE_LOCALS}（源绑定 id → 目标名）作用于整棵子树：
 * 子树中 sourceId 在映射里的变量引用和绑定改用映射给出的名字，其余不动。内层映射覆盖外层。
 */
public class ClauseLocalResolution implements ElixirPass {

    public static final String NAME = "clause-local-resolution";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ElixirNode run(ElixirNode root, PassContext context) {
        return new Resolver().transform(root);
    }

    private static final class Resolver extends ElixirTransformer {
        private final Deque<Map<Integer, String>> scopes = new ArrayDeque<>();

        private Map<Integer, String> current() {
            return scopes.isEmpty() ? Collections.<Integer, String>emptyMap() : scopes.peek();
        }

        @Override
        public ElixirNode transform(ElixirNode node) {
            if (node == null) return null;
            Map<Integer, String> locals = node.meta(Metadata.CLAUSE_LOCALS);
            if (locals == null || locals.isEmpty()) {
                return super.transform(node);
            }
            Map<Integer, String> merged = new HashMap<>(current());
            merged.putAll(locals);
            scopes.push(merged);
            try {
                return super.transform(node);
            } finally {
                scopes.pop();
            }
        }

        @Override
        protected ElixirNode rewriteNode(ElixirNode node) {
            if (node instanceof EVar) {
                EVar var = (EVar) node;
                String target = lookup(var.getSourceId());
                if (target != null) return var.renamed(target);
            }
            return node;
        }

        @Override
        protected ElixirPattern transformPattern(ElixirPattern pattern) {
            if (current().isEmpty()) return pattern;
            return PatternTransformer.rewrite(pattern, p -> {
                if (p instanceof PVar) {
                    String target = lookup(((PVar) p).getSourceId());
                    if (target != null) return ((PVar) p).renamed(target);
                }
                return p;
            });
        }

        private String lookup(Integer sourceId) {
            if (sourceId == null) return null;
            return current().get(sourceId);
        }
    }
}
