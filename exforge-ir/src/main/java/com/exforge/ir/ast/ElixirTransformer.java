package com.exforge.ir.ast;

import com.exforge.ir.ast.control.*;
import com.exforge.ir.ast.data.*;
import com.exforge.ir.ast.decl.*;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.ElixirPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 中间 AST 恒等变换基类（copy-on-change）。
 * <p>
 * 自底向上：先重建子节点，再对结果调用 {@link #rewriteNode}。子节点无变化时返回原节点，
 * 否则构造新节点并复制旧节点的元数据。{@link ERaw} 原样返回，不进入钩子。
 * 子类覆盖 {@link #rewriteNode} 实现局部重写，或覆盖特定 visit 方法控制下降方式。
 */
public class ElixirTransformer implements ElixirVisitor<ElixirNode, Void> {

    /**
     * 变换入口
     */
    public ElixirNode transform(ElixirNode node) {
        if (node == null) return null;
        if (node instanceof ERaw) return node;
        return node.accept(this, null);
    }

    /**
     * 单节点重写钩子，子节点已完成变换。默认不变。
     */
    protected ElixirNode rewriteNode(ElixirNode node) {
        return node;
    }

    /**
     * 模式变换钩子。默认不变。
     */
    protected ElixirPattern transformPattern(ElixirPattern pattern) {
        return pattern;
    }

    /**
     * 以函数作为重写钩子遍历整棵树
     */
    public static ElixirNode rewrite(ElixirNode root, UnaryOperator<ElixirNode> fn) {
        return new ElixirTransformer() {
            @Override
            protected ElixirNode rewriteNode(ElixirNode node) {
                return fn.apply(node);
            }
        }.transform(root);
    }

    // ==================== 辅助方法 ====================

    protected List<ElixirNode> transformList(List<ElixirNode> nodes) {
        List<ElixirNode> result = null;
        for (int i = 0; i < nodes.size(); i++) {
            ElixirNode original = nodes.get(i);
            ElixirNode updated = transform(original);
            if (updated != original && result == null) {
                result = new ArrayList<>(nodes.subList(0, i));
            }
            if (result != null) result.add(updated);
        }
        return result != null ? result : nodes;
    }

    protected List<ElixirPattern> transformPatterns(List<ElixirPattern> patterns) {
        List<ElixirPattern> result = null;
        for (int i = 0; i < patterns.size(); i++) {
            ElixirPattern original = patterns.get(i);
            ElixirPattern updated = transformPattern(original);
            if (updated != original && result == null) {
                result = new ArrayList<>(patterns.subList(0, i));
            }
            if (result != null) result.add(updated);
        }
        return result != null ? result : patterns;
    }

    protected List<ECaseClause> transformCaseClauses(List<ECaseClause> clauses) {
        boolean changed = false;
        List<ECaseClause> result = new ArrayList<>(clauses.size());
        for (ECaseClause clause : clauses) {
            ECaseClause updated = transformCaseClause(clause);
            if (updated != clause) changed = true;
            result.add(updated);
        }
        return changed ? result : clauses;
    }

    protected ECaseClause transformCaseClause(ECaseClause clause) {
        ElixirPattern pattern = transformPattern(clause.getPattern());
        ElixirNode guard = transform(clause.getGuard());
        ElixirNode body = transform(clause.getBody());
        if (pattern == clause.getPattern() && guard == clause.getGuard() && body == clause.getBody()) {
            return clause;
        }
        return new ECaseClause(pattern, guard, body);
    }

    /** 重建后的节点继承旧节点的元数据 */
    protected static <N extends ElixirNode> N rebuilt(ElixirNode original, N replacement) {
        return replacement.withMetadataFrom(original);
    }

    // ==================== 模块/定义 ====================

    @Override
    public ElixirNode visitModule(EModule node, Void ctx) {
        List<ElixirNode> body = transformList(node.getBody());
        ElixirNode result = body == node.getBody() ? node
                : rebuilt(node, new EModule(node.getLocation(), node.getName(), body));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitDef(EDef node, Void ctx) {
        List<ElixirPattern> params = transformPatterns(node.getParams());
        ElixirNode guard = transform(node.getGuard());
        ElixirNode body = transform(node.getBody());
        ElixirNode result = params == node.getParams() && guard == node.getGuard() && body == node.getBody()
                ? node
                : rebuilt(node, new EDef(node.getLocation(), node.getKind(), node.getName(), params, guard, body));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitAttribute(EAttribute node, Void ctx) {
        ElixirNode value = transform(node.getValue());
        ElixirNode result = value == node.getValue() ? node
                : rebuilt(node, new EAttribute(node.getLocation(), node.getName(), value));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitDirective(EDirective node, Void ctx) {
        return rewriteNode(node);
    }

    // ==================== 控制结构 ====================

    @Override
    public ElixirNode visitIf(EIf node, Void ctx) {
        ElixirNode cond = transform(node.getCondition());
        ElixirNode then = transform(node.getThenBranch());
        ElixirNode els = transform(node.getElseBranch());
        ElixirNode result = cond == node.getCondition() && then == node.getThenBranch() && els == node.getElseBranch()
                ? node
                : rebuilt(node, new EIf(node.getLocation(), cond, then, els));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitCase(ECase node, Void ctx) {
        ElixirNode subject = transform(node.getSubject());
        List<ECaseClause> clauses = transformCaseClauses(node.getClauses());
        ElixirNode result = subject == node.getSubject() && clauses == node.getClauses() ? node
                : rebuilt(node, new ECase(node.getLocation(), subject, clauses));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitCond(ECond node, Void ctx) {
        boolean changed = false;
        List<ECondClause> clauses = new ArrayList<>();
        for (ECondClause clause : node.getClauses()) {
            ElixirNode cond = transform(clause.getCondition());
            ElixirNode body = transform(clause.getBody());
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
    public ElixirNode visitTry(ETry node, Void ctx) {
        boolean changed = false;
        ElixirNode body = transform(node.getBody());
        if (body != node.getBody()) changed = true;

        List<ERescueClause> rescues = new ArrayList<>();
        for (ERescueClause clause : node.getRescueClauses()) {
            ElixirNode clauseBody = transform(clause.getBody());
            if (clauseBody != clause.getBody()) {
                changed = true;
                rescues.add(new ERescueClause(clause.getVariable(), clause.getExceptionModules(), clauseBody));
            } else {
                rescues.add(clause);
            }
        }

        List<ECatchClause> catches = new ArrayList<>();
        for (ECatchClause clause : node.getCatchClauses()) {
            ElixirPattern kind = transformPattern(clause.getKind());
            ElixirPattern pattern = transformPattern(clause.getPattern());
            ElixirNode guard = transform(clause.getGuard());
            ElixirNode clauseBody = transform(clause.getBody());
            if (kind != clause.getKind() || pattern != clause.getPattern()
                    || guard != clause.getGuard() || clauseBody != clause.getBody()) {
                changed = true;
                catches.add(new ECatchClause(kind, pattern, guard, clauseBody));
            } else {
                catches.add(clause);
            }
        }

        List<ECaseClause> elses = transformCaseClauses(node.getElseClauses());
        if (elses != node.getElseClauses()) changed = true;
        ElixirNode after = transform(node.getAfter());
        if (after != node.getAfter()) changed = true;

        ElixirNode result = changed
                ? rebuilt(node, new ETry(node.getLocation(), body, rescues, catches, elses, after))
                : node;
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitWith(EWith node, Void ctx) {
        boolean changed = false;
        List<EWithClause> clauses = new ArrayList<>();
        for (EWithClause clause : node.getClauses()) {
            ElixirPattern pattern = transformPattern(clause.getPattern());
            ElixirNode value = transform(clause.getValue());
            if (pattern != clause.getPattern() || value != clause.getValue()) {
                changed = true;
                clauses.add(new EWithClause(pattern, value));
            } else {
                clauses.add(clause);
            }
        }
        ElixirNode body = transform(node.getBody());
        List<ECaseClause> elses = transformCaseClauses(node.getElseClauses());
        if (body != node.getBody() || elses != node.getElseClauses()) changed = true;
        ElixirNode result = changed
                ? rebuilt(node, new EWith(node.getLocation(), clauses, body, elses))
                : node;
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitReceive(EReceive node, Void ctx) {
        List<ECaseClause> clauses = transformCaseClauses(node.getClauses());
        ElixirNode timeout = transform(node.getAfterTimeout());
        ElixirNode afterBody = transform(node.getAfterBody());
        ElixirNode result = clauses == node.getClauses() && timeout == node.getAfterTimeout()
                && afterBody == node.getAfterBody()
                ? node
                : rebuilt(node, new EReceive(node.getLocation(), clauses, timeout, afterBody));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitWhileLoop(EWhileLoop node, Void ctx) {
        ElixirNode cond = transform(node.getCondition());
        ElixirNode body = transform(node.getBody());
        ElixirNode result = cond == node.getCondition() && body == node.getBody() ? node
                : rebuilt(node, new EWhileLoop(node.getLocation(), cond, body));
        return rewriteNode(result);
    }

    // ==================== 数据字面量 ====================

    @Override
    public ElixirNode visitList(EList node, Void ctx) {
        List<ElixirNode> elements = transformList(node.getElements());
        ElixirNode result = elements == node.getElements() ? node
                : rebuilt(node, new EList(node.getLocation(), elements));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitTuple(ETuple node, Void ctx) {
        List<ElixirNode> elements = transformList(node.getElements());
        ElixirNode result = elements == node.getElements() ? node
                : rebuilt(node, new ETuple(node.getLocation(), elements));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitMap(EMap node, Void ctx) {
        ElixirNode base = transform(node.getBase());
        boolean changed = base != node.getBase();
        List<EMapEntry> entries = new ArrayList<>();
        for (EMapEntry entry : node.getEntries()) {
            ElixirNode key = transform(entry.getKey());
            ElixirNode value = transform(entry.getValue());
            if (key != entry.getKey() || value != entry.getValue()) {
                changed = true;
                entries.add(new EMapEntry(key, value));
            } else {
                entries.add(entry);
            }
        }
        ElixirNode result = changed ? rebuilt(node, new EMap(node.getLocation(), base, entries)) : node;
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitKeywordList(EKeywordList node, Void ctx) {
        List<EKeywordPair> pairs = transformPairs(node.getPairs());
        ElixirNode result = pairs == node.getPairs() ? node
                : rebuilt(node, new EKeywordList(node.getLocation(), pairs));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitStruct(EStruct node, Void ctx) {
        ElixirNode base = transform(node.getBase());
        List<EKeywordPair> fields = transformPairs(node.getFields());
        ElixirNode result = base == node.getBase() && fields == node.getFields() ? node
                : rebuilt(node, new EStruct(node.getLocation(), node.getModule(), base, fields));
        return rewriteNode(result);
    }

    private List<EKeywordPair> transformPairs(List<EKeywordPair> pairs) {
        boolean changed = false;
        List<EKeywordPair> result = new ArrayList<>(pairs.size());
        for (EKeywordPair pair : pairs) {
            ElixirNode value = transform(pair.getValue());
            if (value != pair.getValue()) {
                changed = true;
                result.add(new EKeywordPair(pair.getKey(), value));
            } else {
                result.add(pair);
            }
        }
        return changed ? result : pairs;
    }

    @Override
    public ElixirNode visitBitString(EBitString node, Void ctx) {
        boolean changed = false;
        List<EBitSegment> segments = new ArrayList<>();
        for (EBitSegment seg : node.getSegments()) {
            ElixirNode value = transform(seg.getValue());
            ElixirNode size = transform(seg.getSize());
            if (value != seg.getValue() || size != seg.getSize()) {
                changed = true;
                segments.add(new EBitSegment(value, size, seg.getType()));
            } else {
                segments.add(seg);
            }
        }
        ElixirNode result = changed ? rebuilt(node, new EBitString(node.getLocation(), segments)) : node;
        return rewriteNode(result);
    }

    // ==================== 表达式/绑定 ====================

    @Override
    public ElixirNode visitCall(ECall node, Void ctx) {
        List<ElixirNode> args = transformList(node.getArgs());
        ElixirNode result = args == node.getArgs() ? node
                : rebuilt(node, new ECall(node.getLocation(), node.getName(), args));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitRemoteCall(ERemoteCall node, Void ctx) {
        ElixirNode module = transform(node.getModule());
        List<ElixirNode> args = transformList(node.getArgs());
        ElixirNode result = module == node.getModule() && args == node.getArgs() ? node
                : rebuilt(node, new ERemoteCall(node.getLocation(), module, node.getFunction(), args));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitApply(EApply node, Void ctx) {
        ElixirNode fn = transform(node.getFunction());
        List<ElixirNode> args = transformList(node.getArgs());
        ElixirNode result = fn == node.getFunction() && args == node.getArgs() ? node
                : rebuilt(node, new EApply(node.getLocation(), fn, args));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitBinary(EBinary node, Void ctx) {
        ElixirNode left = transform(node.getLeft());
        ElixirNode right = transform(node.getRight());
        ElixirNode result = left == node.getLeft() && right == node.getRight() ? node
                : rebuilt(node, new EBinary(node.getLocation(), node.getOperator(), left, right));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitUnary(EUnary node, Void ctx) {
        ElixirNode operand = transform(node.getOperand());
        ElixirNode result = operand == node.getOperand() ? node
                : rebuilt(node, new EUnary(node.getLocation(), node.getOperator(), operand));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitField(EField node, Void ctx) {
        ElixirNode target = transform(node.getTarget());
        ElixirNode result = target == node.getTarget() ? node
                : rebuilt(node, new EField(node.getLocation(), target, node.getField()));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitAccess(EAccess node, Void ctx) {
        ElixirNode target = transform(node.getTarget());
        ElixirNode key = transform(node.getKey());
        ElixirNode result = target == node.getTarget() && key == node.getKey() ? node
                : rebuilt(node, new EAccess(node.getLocation(), target, key));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitRange(ERange node, Void ctx) {
        ElixirNode first = transform(node.getFirst());
        ElixirNode last = transform(node.getLast());
        ElixirNode step = transform(node.getStep());
        ElixirNode result = first == node.getFirst() && last == node.getLast() && step == node.getStep()
                ? node
                : rebuilt(node, new ERange(node.getLocation(), first, last, step));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitBlock(EBlock node, Void ctx) {
        List<ElixirNode> stmts = transformList(node.getStatements());
        ElixirNode result = stmts == node.getStatements() ? node
                : rebuilt(node, new EBlock(node.getLocation(), stmts));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitParen(EParen node, Void ctx) {
        ElixirNode expr = transform(node.getExpr());
        ElixirNode result = expr == node.getExpr() ? node
                : rebuilt(node, new EParen(node.getLocation(), expr));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitMatch(EMatch node, Void ctx) {
        ElixirPattern pattern = transformPattern(node.getPattern());
        ElixirNode value = transform(node.getValue());
        ElixirNode result = pattern == node.getPattern() && value == node.getValue() ? node
                : rebuilt(node, new EMatch(node.getLocation(), pattern, value));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitAssign(EAssign node, Void ctx) {
        ElixirNode target = transform(node.getTarget());
        ElixirNode value = transform(node.getValue());
        ElixirNode result = target == node.getTarget() && value == node.getValue() ? node
                : rebuilt(node, new EAssign(node.getLocation(), target, node.getOperator(), value));
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitFn(EFn node, Void ctx) {
        boolean changed = false;
        List<EFnClause> clauses = new ArrayList<>();
        for (EFnClause clause : node.getClauses()) {
            List<ElixirPattern> params = transformPatterns(clause.getParams());
            ElixirNode guard = transform(clause.getGuard());
            ElixirNode body = transform(clause.getBody());
            if (params != clause.getParams() || guard != clause.getGuard() || body != clause.getBody()) {
                changed = true;
                clauses.add(new EFnClause(params, guard, body));
            } else {
                clauses.add(clause);
            }
        }
        ElixirNode result = changed ? rebuilt(node, new EFn(node.getLocation(), clauses)) : node;
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitFor(EFor node, Void ctx) {
        boolean changed = false;
        List<EForGenerator> generators = new ArrayList<>();
        for (EForGenerator gen : node.getGenerators()) {
            ElixirPattern pattern = transformPattern(gen.getPattern());
            ElixirNode source = transform(gen.getSource());
            if (pattern != gen.getPattern() || source != gen.getSource()) {
                changed = true;
                generators.add(new EForGenerator(pattern, source));
            } else {
                generators.add(gen);
            }
        }
        List<ElixirNode> filters = transformList(node.getFilters());
        ElixirNode into = transform(node.getInto());
        ElixirNode body = transform(node.getBody());
        if (filters != node.getFilters() || into != node.getInto() || body != node.getBody()) changed = true;
        ElixirNode result = changed
                ? rebuilt(node, new EFor(node.getLocation(), generators, filters, into, body))
                : node;
        return rewriteNode(result);
    }

    @Override
    public ElixirNode visitRaw(ERaw node, Void ctx) {
        return node;
    }

    // ==================== 叶节点 ====================

    @Override
    public ElixirNode visitVar(EVar node, Void ctx) {
        return rewriteNode(node);
    }

    @Override
    public ElixirNode visitLiteral(ELiteral node, Void ctx) {
        return rewriteNode(node);
    }

    @Override
    public ElixirNode visitAtom(EAtom node, Void ctx) {
        return rewriteNode(node);
    }

    @Override
    public ElixirNode visitAlias(EAlias node, Void ctx) {
        return rewriteNode(node);
    }

    @Override
    public ElixirNode visitNil(ENil node, Void ctx) {
        return rewriteNode(node);
    }

    @Override
    public ElixirNode visitUnderscore(EUnderscore node, Void ctx) {
        return rewriteNode(node);
    }
}
