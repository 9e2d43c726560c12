package com.exforge.ir.ast;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.data.EList;
import com.exforge.ir.ast.data.ETuple;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.ElixirPattern;
import com.exforge.ir.ast.pattern.PTuple;
import com.exforge.ir.ast.pattern.PVar;
import com.exforge.ir.ast.pattern.PWildcard;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 节点构造与形状判断的便捷方法，供构建器、pass 和测试使用
 */
public final class Nodes {

    private static final SourceLocation NOWHERE = SourceLocation.UNKNOWN;

    private Nodes() {
    }

    // ==================== 构造 ====================

    public static EVar var(String name) {
        return new EVar(NOWHERE, name);
    }

    public static EAtom atom(String name) {
        return new EAtom(NOWHERE, name);
    }

    public static EAlias alias(String name) {
        return new EAlias(NOWHERE, name);
    }

    public static ENil nil() {
        return new ENil(NOWHERE);
    }

    public static ELiteral integer(long value) {
        return ELiteral.ofInt(value);
    }

    public static ELiteral string(String value) {
        return ELiteral.ofString(value);
    }

    public static ELiteral bool(boolean value) {
        return ELiteral.ofBoolean(value);
    }

    public static ECall call(String name, ElixirNode... args) {
        return new ECall(NOWHERE, name, list(args));
    }

    public static ERemoteCall remote(String module, String function, ElixirNode... args) {
        return new ERemoteCall(NOWHERE, alias(module), function, list(args));
    }

    public static EBinary binary(BinaryOp op, ElixirNode left, ElixirNode right) {
        return new EBinary(NOWHERE, op, left, right);
    }

    public static EBlock block(ElixirNode... statements) {
        return new EBlock(NOWHERE, list(statements));
    }

    public static EBlock block(List<ElixirNode> statements) {
        return new EBlock(NOWHERE, statements);
    }

    public static EList listOf(ElixirNode... elements) {
        return new EList(NOWHERE, list(elements));
    }

    public static ETuple tuple(ElixirNode... elements) {
        return new ETuple(NOWHERE, list(elements));
    }

    /** name = value */
    public static EMatch bind(String name, ElixirNode value) {
        return new EMatch(value != null ? value.getLocation() : NOWHERE, pvar(name), value);
    }

    public static PVar pvar(String name) {
        return new PVar(NOWHERE, name);
    }

    public static PWildcard wildcard() {
        return new PWildcard(NOWHERE);
    }

    public static PTuple ptuple(ElixirPattern... elements) {
        return new PTuple(NOWHERE, new ArrayList<>(Arrays.asList(elements)));
    }

    private static List<ElixirNode> list(ElixirNode[] nodes) {
        if (nodes.length == 0) return Collections.emptyList();
        return new ArrayList<>(Arrays.asList(nodes));
    }

    // ==================== 形状判断 ====================

    public static boolean isVar(ElixirNode node, String name) {
        return node instanceof EVar && ((EVar) node).getName().equals(name);
    }

    public static boolean isNil(ElixirNode node) {
        return node instanceof ENil;
    }

    public static boolean isIntLiteral(ElixirNode node, long value) {
        return node instanceof ELiteral && ((ELiteral) node).isInteger() && ((ELiteral) node).asLong() == value;
    }

    /** 形如 name = value 的简单绑定时返回变量名，否则 null */
    public static String boundName(ElixirNode node) {
        if (node instanceof EMatch && ((EMatch) node).getPattern() instanceof PVar) {
            return ((PVar) ((EMatch) node).getPattern()).getName();
        }
        return null;
    }

    /** 去掉外层括号 */
    public static ElixirNode unparen(ElixirNode node) {
        ElixirNode current = node;
        while (current instanceof EParen) {
            current = ((EParen) current).getExpr();
        }
        return current;
    }

    /** 单语句块展开为该语句，其他节点原样返回 */
    public static ElixirNode unwrapSingleton(ElixirNode node) {
        if (node instanceof EBlock && ((EBlock) node).size() == 1) {
            return ((EBlock) node).getStatements().get(0);
        }
        return node;
    }

    /** 块的语句列表，非块视为单语句 */
    public static List<ElixirNode> statementsOf(ElixirNode node) {
        if (node == null) return Collections.emptyList();
        if (node instanceof EBlock) return ((EBlock) node).getStatements();
        return Collections.singletonList(node);
    }

    /** 由语句列表构造体：单语句直接返回该语句 */
    public static ElixirNode bodyOf(SourceLocation location, List<ElixirNode> statements) {
        if (statements.size() == 1) return statements.get(0);
        return new EBlock(location, statements);
    }
}
