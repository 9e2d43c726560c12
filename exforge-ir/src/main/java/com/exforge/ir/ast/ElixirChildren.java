package com.exforge.ir.ast;

import com.exforge.ir.ast.control.*;
import com.exforge.ir.ast.data.*;
import com.exforge.ir.ast.decl.*;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.ElixirPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 子节点枚举，只读遍历的基本操作。
 * <p>
 * 按源码顺序列出节点的直接子表达式和直接子模式。{@link ERaw} 没有子节点。
 */
public final class ElixirChildren {

    private ElixirChildren() {
    }

    /** 直接子表达式（按源码顺序） */
    public static void forEachChild(ElixirNode node, Consumer<ElixirNode> action) {
        if (node == null) return;
        node.accept(new Enumerator(action, null), null);
    }

    /** 节点直接持有的模式（参数、子句模式、匹配左侧） */
    public static void forEachPattern(ElixirNode node, Consumer<ElixirPattern> action) {
        if (node == null) return;
        node.accept(new Enumerator(null, action), null);
    }

    public static List<ElixirNode> children(ElixirNode node) {
        List<ElixirNode> result = new ArrayList<>();
        forEachChild(node, result::add);
        return result;
    }

    /** 先序遍历整棵子树（含根） */
    public static void walk(ElixirNode root, Consumer<ElixirNode> action) {
        if (root == null) return;
        action.accept(root);
        forEachChild(root, child -> walk(child, action));
    }

    /** 子树中是否存在满足条件的节点（含根） */
    public static boolean any(ElixirNode root, Predicate<ElixirNode> predicate) {
        if (root == null) return false;
        if (predicate.test(root)) return true;
        for (ElixirNode child : children(root)) {
            if (any(child, predicate)) return true;
        }
        return false;
    }

    private static final class Enumerator implements ElixirVisitor<Void, Void> {
        private final Consumer<ElixirNode> nodes;
        private final Consumer<ElixirPattern> patterns;

        Enumerator(Consumer<ElixirNode> nodes, Consumer<ElixirPattern> patterns) {
            this.nodes = nodes;
            this.patterns = patterns;
        }

        private void node(ElixirNode n) {
            if (n != null && nodes != null) nodes.accept(n);
        }

        private void nodes(List<? extends ElixirNode> list) {
            for (ElixirNode n : list) node(n);
        }

        private void pattern(ElixirPattern p) {
            if (p != null && patterns != null) patterns.accept(p);
        }

        private void clauses(List<ECaseClause> clauses) {
            for (ECaseClause clause : clauses) {
                pattern(clause.getPattern());
                node(clause.getGuard());
                node(clause.getBody());
            }
        }

        @Override
        public Void visitModule(EModule n, Void c) {
            nodes(n.getBody());
            return null;
        }

        @Override
        public Void visitDef(EDef n, Void c) {
            for (ElixirPattern p : n.getParams()) pattern(p);
            node(n.getGuard());
            node(n.getBody());
            return null;
        }

        @Override
        public Void visitAttribute(EAttribute n, Void c) {
            node(n.getValue());
            return null;
        }

        @Override
        public Void visitDirective(EDirective n, Void c) {
            return null;
        }

        @Override
        public Void visitIf(EIf n, Void c) {
            node(n.getCondition());
            node(n.getThenBranch());
            node(n.getElseBranch());
            return null;
        }

        @Override
        public Void visitCase(ECase n, Void c) {
            node(n.getSubject());
            clauses(n.getClauses());
            return null;
        }

        @Override
        public Void visitCond(ECond n, Void c) {
            for (ECondClause clause : n.getClauses()) {
                node(clause.getCondition());
                node(clause.getBody());
            }
            return null;
        }

        @Override
        public Void visitTry(ETry n, Void c) {
            node(n.getBody());
            for (ERescueClause clause : n.getRescueClauses()) node(clause.getBody());
            for (ECatchClause clause : n.getCatchClauses()) {
                pattern(clause.getKind());
                pattern(clause.getPattern());
                node(clause.getGuard());
                node(clause.getBody());
            }
            clauses(n.getElseClauses());
            node(n.getAfter());
            return null;
        }

        @Override
        public Void visitWith(EWith n, Void c) {
            for (EWithClause clause : n.getClauses()) {
                pattern(clause.getPattern());
                node(clause.getValue());
            }
            node(n.getBody());
            clauses(n.getElseClauses());
            return null;
        }

        @Override
        public Void visitReceive(EReceive n, Void c) {
            clauses(n.getClauses());
            node(n.getAfterTimeout());
            node(n.getAfterBody());
            return null;
        }

        @Override
        public Void visitWhileLoop(EWhileLoop n, Void c) {
            node(n.getCondition());
            node(n.getBody());
            return null;
        }

        @Override
        public Void visitList(EList n, Void c) {
            nodes(n.getElements());
            return null;
        }

        @Override
        public Void visitTuple(ETuple n, Void c) {
            nodes(n.getElements());
            return null;
        }

        @Override
        public Void visitMap(EMap n, Void c) {
            node(n.getBase());
            for (EMapEntry entry : n.getEntries()) {
                node(entry.getKey());
                node(entry.getValue());
            }
            return null;
        }

        @Override
        public Void visitKeywordList(EKeywordList n, Void c) {
            for (EKeywordPair pair : n.getPairs()) node(pair.getValue());
            return null;
        }

        @Override
        public Void visitStruct(EStruct n, Void c) {
            node(n.getBase());
            for (EKeywordPair pair : n.getFields()) node(pair.getValue());
            return null;
        }

        @Override
        public Void visitBitString(EBitString n, Void c) {
            for (EBitSegment seg : n.getSegments()) {
                node(seg.getValue());
                node(seg.getSize());
            }
            return null;
        }

        @Override
        public Void visitCall(ECall n, Void c) {
            nodes(n.getArgs());
            return null;
        }

        @Override
        public Void visitRemoteCall(ERemoteCall n, Void c) {
            node(n.getModule());
            nodes(n.getArgs());
            return null;
        }

        @Override
        public Void visitApply(EApply n, Void c) {
            node(n.getFunction());
            nodes(n.getArgs());
            return null;
        }

        @Override
        public Void visitBinary(EBinary n, Void c) {
            node(n.getLeft());
            node(n.getRight());
            return null;
        }

        @Override
        public Void visitUnary(EUnary n, Void c) {
            node(n.getOperand());
            return null;
        }

        @Override
        public Void visitField(EField n, Void c) {
            node(n.getTarget());
            return null;
        }

        @Override
        public Void visitAccess(EAccess n, Void c) {
            node(n.getTarget());
            node(n.getKey());
            return null;
        }

        @Override
        public Void visitRange(ERange n, Void c) {
            node(n.getFirst());
            node(n.getLast());
            node(n.getStep());
            return null;
        }

        @Override
        public Void visitBlock(EBlock n, Void c) {
            nodes(n.getStatements());
            return null;
        }

        @Override
        public Void visitParen(EParen n, Void c) {
            node(n.getExpr());
            return null;
        }

        @Override
        public Void visitMatch(EMatch n, Void c) {
            pattern(n.getPattern());
            node(n.getValue());
            return null;
        }

        @Override
        public Void visitAssign(EAssign n, Void c) {
            node(n.getTarget());
            node(n.getValue());
            return null;
        }

        @Override
        public Void visitFn(EFn n, Void c) {
            for (EFnClause clause : n.getClauses()) {
                for (ElixirPattern p : clause.getParams()) pattern(p);
                node(clause.getGuard());
                node(clause.getBody());
            }
            return null;
        }

        @Override
        public Void visitFor(EFor n, Void c) {
            for (EForGenerator gen : n.getGenerators()) {
                pattern(gen.getPattern());
                node(gen.getSource());
            }
            nodes(n.getFilters());
            node(n.getInto());
            node(n.getBody());
            return null;
        }

        @Override
        public Void visitRaw(ERaw n, Void c) {
            return null;
        }

        @Override
        public Void visitVar(EVar n, Void c) {
            return null;
        }

        @Override
        public Void visitLiteral(ELiteral n, Void c) {
            return null;
        }

        @Override
        public Void visitAtom(EAtom n, Void c) {
            return null;
        }

        @Override
        public Void visitAlias(EAlias n, Void c) {
            return null;
        }

        @Override
        public Void visitNil(ENil n, Void c) {
            return null;
        }

        @Override
        public Void visitUnderscore(EUnderscore n, Void c) {
            return null;
        }
    }
}
