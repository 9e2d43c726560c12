package com.exforge.ir.ast;

import com.exforge.ir.ast.data.*;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.*;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 变量读写与纯度分析。
 * <p>
 * "读取"指表达式位置的 {@link EVar} 以及模式中的 {@link PPin}；
 * 模式中的 {@link PVar} 和 {@link EAssign} 的变量目标是写入，不计为读取。
 */
public final class VarUsage {

    private VarUsage() {
    }

    /** 遍历模式中的绑定名和固定名 */
    public static void forEachPatternName(ElixirPattern pattern, Consumer<String> binds, Consumer<String> pins) {
        if (pattern == null) return;
        pattern.accept(new PatternNames(binds, pins), null);
    }

    public static Set<String> boundNames(ElixirPattern pattern) {
        Set<String> names = new LinkedHashSet<>();
        forEachPatternName(pattern, names::add, name -> { });
        return names;
    }

    /** 子树中对 name 的读取次数 */
    public static int countReads(ElixirNode root, String name) {
        int[] count = {0};
        forEachRead(root, read -> {
            if (read.equals(name)) count[0]++;
        });
        return count[0];
    }

    public static boolean reads(ElixirNode root, String name) {
        return countReads(root, name) > 0;
    }

    /** 子树中所有被读取的名字 */
    public static Set<String> readNames(ElixirNode root) {
        Set<String> names = new LinkedHashSet<>();
        forEachRead(root, names::add);
        return names;
    }

    /** 子树中是否绑定（模式或命令式赋值）name */
    public static boolean binds(ElixirNode root, String name) {
        boolean[] found = {false};
        ElixirChildren.walk(root, node -> {
            if (node instanceof EAssign && Nodes.isVar(((EAssign) node).getTarget(), name)) found[0] = true;
            ElixirChildren.forEachPattern(node, p -> forEachPatternName(p, bound -> {
                if (bound.equals(name)) found[0] = true;
            }, pin -> { }));
        });
        return found[0];
    }

    /** 子树中以任何形式（读取或绑定）出现的名字 */
    public static boolean mentions(ElixirNode root, String name) {
        return reads(root, name) || binds(root, name);
    }

    /** 子树中绑定的所有名字 */
    public static Set<String> boundNamesIn(ElixirNode root) {
        Set<String> names = new LinkedHashSet<>();
        ElixirChildren.walk(root, node -> {
            if (node instanceof EAssign && ((EAssign) node).getTarget() instanceof EVar) {
                names.add(((EVar) ((EAssign) node).getTarget()).getName());
            }
            ElixirChildren.forEachPattern(node, p -> forEachPatternName(p, names::add, pin -> { }));
        });
        return names;
    }

    public static void forEachRead(ElixirNode node, Consumer<String> action) {
        if (node == null) return;
        if (node instanceof EVar) {
            action.accept(((EVar) node).getName());
            return;
        }
        if (node instanceof EAssign && ((EAssign) node).getTarget() instanceof EVar) {
            EAssign assign = (EAssign) node;
            // 复合赋值 x += 1 读取 x
            if (assign.getOperator() != null) action.accept(((EVar) assign.getTarget()).getName());
            forEachRead(assign.getValue(), action);
            return;
        }
        ElixirChildren.forEachPattern(node, p -> forEachPatternName(p, bound -> { }, action));
        ElixirChildren.forEachChild(node, child -> forEachRead(child, action));
    }

    /**
     * 求值没有副作用的表达式：叶节点、字段访问、由纯元素组成的字面量、非自增的运算、匿名函数。
     */
    public static boolean isPure(ElixirNode node) {
        if (node == null) return true;
        if (node instanceof EVar || node instanceof ELiteral || node instanceof EAtom
                || node instanceof EAlias || node instanceof ENil || node instanceof EUnderscore
                || node instanceof EFn) {
            return true;
        }
        if (node instanceof EField) return isPure(((EField) node).getTarget());
        if (node instanceof EParen) return isPure(((EParen) node).getExpr());
        if (node instanceof EUnary) {
            EUnary unary = (EUnary) node;
            return !unary.getOperator().isMutating() && isPure(unary.getOperand());
        }
        if (node instanceof EBinary) {
            EBinary binary = (EBinary) node;
            return binary.getOperator() != BinaryOp.PIPE && isPure(binary.getLeft()) && isPure(binary.getRight());
        }
        if (node instanceof EList || node instanceof ETuple || node instanceof EMap
                || node instanceof EStruct || node instanceof EKeywordList || node instanceof ERange) {
            for (ElixirNode child : ElixirChildren.children(node)) {
                if (!isPure(child)) return false;
            }
            return true;
        }
        return false;
    }

    /** 可以无代价重复求值的表达式：叶节点或叶节点上的字段访问 */
    public static boolean isTrivial(ElixirNode node) {
        if (node instanceof EVar || node instanceof ELiteral || node instanceof EAtom
                || node instanceof EAlias || node instanceof ENil) {
            return true;
        }
        if (node instanceof EField) return isTrivial(((EField) node).getTarget());
        return false;
    }

    private static final class PatternNames implements PatternVisitor<Void, Void> {
        private final Consumer<String> binds;
        private final Consumer<String> pins;

        PatternNames(Consumer<String> binds, Consumer<String> pins) {
            this.binds = binds;
            this.pins = pins;
        }

        private void walk(ElixirPattern pattern) {
            if (pattern != null) pattern.accept(this, null);
        }

        @Override
        public Void visitVar(PVar p, Void c) {
            binds.accept(p.getName());
            return null;
        }

        @Override
        public Void visitLiteral(PLiteral p, Void c) {
            return null;
        }

        @Override
        public Void visitTuple(PTuple p, Void c) {
            p.getElements().forEach(this::walk);
            return null;
        }

        @Override
        public Void visitList(PList p, Void c) {
            p.getElements().forEach(this::walk);
            return null;
        }

        @Override
        public Void visitCons(PCons p, Void c) {
            p.getHeads().forEach(this::walk);
            walk(p.getTail());
            return null;
        }

        @Override
        public Void visitMap(PMap p, Void c) {
            for (PMapEntry entry : p.getEntries()) walk(entry.getValue());
            return null;
        }

        @Override
        public Void visitStruct(PStruct p, Void c) {
            for (PFieldPattern field : p.getFields()) walk(field.getPattern());
            return null;
        }

        @Override
        public Void visitPin(PPin p, Void c) {
            pins.accept(p.getName());
            return null;
        }

        @Override
        public Void visitWildcard(PWildcard p, Void c) {
            return null;
        }

        @Override
        public Void visitBinary(PBinary p, Void c) {
            for (PBinarySegment seg : p.getSegments()) walk(seg.getPattern());
            return null;
        }
    }
}
