package com.exforge.ir.backend;

import com.exforge.ir.InternalCompilerError;
import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;
import com.exforge.ir.ast.control.*;
import com.exforge.ir.ast.data.*;
import com.exforge.ir.ast.decl.*;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.*;
import com.exforge.ir.pass.FreshNameGenerator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 中间 AST → Elixir 源码打印器
 *
 * <p>对每个节点变体都有渲染规则的全函数；缺少必需子节点或遇到无法渲染的字面量时抛出
 * {@link InternalCompilerError}，这表示前面的阶段产生了错误的形状。</p>
 *
 * <ul>
 *   <li>简单表达式使用单行形式（{@code if c, do: a, else: b}、{@code def f(x), do: e}），否则使用 do/end 块；</li>
 *   <li>二元运算中的减法子表达式总是加括号，控制结构作为运算数、参数或字面量槽位时加括号；</li>
 *   <li>取余与位运算打印为限定函数调用；</li>
 *   <li>只允许单个表达式的位置出现多语句块时，打印为立即调用的匿名函数。</li>
 * </ul>
 */
public class ElixirPrinter implements ElixirVisitor<Void, PrinterContext> {

    private static final String STAGE = "printer";

    /** 不带括号调用的模块级宏 */
    private static final Set<String> BARE_MACROS = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("defexception", "defstruct")));

    private final PrintConfig config;
    private final FreshNameGenerator names;
    private final PatternPrinter patternPrinter = new PatternPrinter();

    public ElixirPrinter() {
        this(new PrintConfig());
    }

    public ElixirPrinter(PrintConfig config) {
        this(config, new FreshNameGenerator());
    }

    /**
     * @param names 循环函数名生成器；与 pass 管线共享时名字在整个编译单元内唯一
     */
    public ElixirPrinter(PrintConfig config, FreshNameGenerator names) {
        this.config = config != null ? config : new PrintConfig();
        this.names = names != null ? names : new FreshNameGenerator();
    }

    /**
     * 以零缩进打印节点
     */
    public String print(ElixirNode node) {
        if (node == null) {
            throw new InternalCompilerError(STAGE, "cannot print a missing root", null);
        }
        PrinterContext ctx = new PrinterContext(config);
        printBody(node, ctx);
        return ctx.getOutput();
    }

    /**
     * 默认配置下的规范文本，用于结构比较。每次调用使用新的名字生成器，结构相同的树文本相同。
     */
    public static String canonical(ElixirNode node) {
        return new ElixirPrinter().print(node);
    }

    // ============ 辅助 ============

    private void expr(ElixirNode node, PrinterContext ctx) {
        if (node == null) {
            throw new InternalCompilerError(STAGE, "missing child expression", null);
        }
        node.accept(this, ctx);
    }

    private void pattern(ElixirPattern pattern, PrinterContext ctx) {
        if (pattern == null) {
            throw new InternalCompilerError(STAGE, "missing pattern", null);
        }
        pattern.accept(patternPrinter, ctx);
    }

    /** 语句序列，嵌套块展开；空体打印为 nil */
    private void printBody(ElixirNode body, PrinterContext ctx) {
        List<ElixirNode> stmts = new ArrayList<>();
        flatten(body, stmts);
        printStatements(stmts, ctx);
    }

    private void printStatements(List<ElixirNode> stmts, PrinterContext ctx) {
        if (stmts.isEmpty()) {
            ctx.append("nil");
            return;
        }
        for (int i = 0; i < stmts.size(); i++) {
            if (i > 0) ctx.newLine();
            expr(stmts.get(i), ctx);
        }
    }

    private static void flatten(ElixirNode node, List<ElixirNode> out) {
        if (node instanceof EBlock) {
            for (ElixirNode stmt : ((EBlock) node).getStatements()) flatten(stmt, out);
        } else if (node != null) {
            out.add(node);
        }
    }

    /** " do" + 缩进的体，光标停在下一行行首 */
    private void doBlock(ElixirNode body, PrinterContext ctx) {
        ctx.append(" do");
        ctx.newLine();
        indentedBody(body, ctx);
    }

    private void indentedBody(ElixirNode body, PrinterContext ctx) {
        ctx.indent();
        printBody(body, ctx);
        ctx.newLine();
        ctx.dedent();
    }

    /** 子句箭头与体：简单体同行，否则换行缩进 */
    private void arrowBody(ElixirNode body, PrinterContext ctx) {
        ctx.append(" ->");
        if (body == null || isSimple(body)) {
            ctx.append(" ");
            if (body == null) {
                ctx.append("nil");
            } else {
                expr(body, ctx);
            }
            return;
        }
        ctx.newLine();
        ctx.indent();
        printBody(body, ctx);
        ctx.dedent();
    }

    /** 参数或字面量槽位中的表达式：控制结构加括号 */
    private void arg(ElixirNode node, PrinterContext ctx) {
        if (isControl(node)) {
            ctx.append("(");
            expr(node, ctx);
            ctx.append(")");
        } else {
            expr(node, ctx);
        }
    }

    private void args(List<ElixirNode> nodes, PrinterContext ctx) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) ctx.append(", ");
            arg(nodes.get(i), ctx);
        }
    }

    private void patterns(List<ElixirPattern> patterns, PrinterContext ctx) {
        for (int i = 0; i < patterns.size(); i++) {
            if (i > 0) ctx.append(", ");
            pattern(patterns.get(i), ctx);
        }
    }

    private void keywordPairs(List<EKeywordPair> pairs, PrinterContext ctx) {
        for (int i = 0; i < pairs.size(); i++) {
            if (i > 0) ctx.append(", ");
            ctx.append(ElixirStringUtils.keywordKey(pairs.get(i).getKey()));
            ctx.append(" ");
            arg(pairs.get(i).getValue(), ctx);
        }
    }

    private void parenthesized(ElixirNode node, boolean parens, PrinterContext ctx) {
        if (parens) ctx.append("(");
        expr(node, ctx);
        if (parens) ctx.append(")");
    }

    private static boolean isControl(ElixirNode node) {
        return node instanceof EIf || node instanceof ECase || node instanceof ECond
                || node instanceof ETry || node instanceof EWith || node instanceof EReceive
                || node instanceof EFor;
    }

    private static boolean isInfix(ElixirNode node) {
        return node instanceof EBinary && !((EBinary) node).getOperator().isFunction();
    }

    /**
     * 可单行渲染的表达式：字面量、变量、字段访问、元组/列表/映射字面量、至多两个参数的调用、
     * 简单运算数上的运算。赋值、空块以及包含它们的表达式都不简单。
     */
    static boolean isSimple(ElixirNode node) {
        if (node == null) return false;
        if (node instanceof EVar || node instanceof ELiteral || node instanceof EAtom
                || node instanceof EAlias || node instanceof ENil || node instanceof EUnderscore) {
            return true;
        }
        if (node instanceof ERaw) return ((ERaw) node).getCode().indexOf('\n') < 0;
        if (node instanceof EField) return isSimple(((EField) node).getTarget());
        if (node instanceof EAccess) {
            return isSimple(((EAccess) node).getTarget()) && isSimple(((EAccess) node).getKey());
        }
        if (node instanceof EParen) return isSimple(((EParen) node).getExpr());
        if (node instanceof EList) return allSimple(((EList) node).getElements());
        if (node instanceof ETuple) return allSimple(((ETuple) node).getElements());
        if (node instanceof EMap) {
            EMap map = (EMap) node;
            if (map.getBase() != null && !isSimple(map.getBase())) return false;
            for (EMapEntry entry : map.getEntries()) {
                if (!isSimple(entry.getKey()) || !isSimple(entry.getValue())) return false;
            }
            return true;
        }
        if (node instanceof EKeywordList) return pairsSimple(((EKeywordList) node).getPairs());
        if (node instanceof EStruct) {
            EStruct struct = (EStruct) node;
            return (struct.getBase() == null || isSimple(struct.getBase())) && pairsSimple(struct.getFields());
        }
        if (node instanceof ECall) {
            List<ElixirNode> args = ((ECall) node).getArgs();
            return args.size() <= 2 && allSimple(args);
        }
        if (node instanceof ERemoteCall) {
            ERemoteCall call = (ERemoteCall) node;
            return call.getArgs().size() <= 2 && isSimple(call.getModule()) && allSimple(call.getArgs());
        }
        if (node instanceof EApply) {
            EApply apply = (EApply) node;
            return apply.getArgs().size() <= 2 && isSimple(apply.getFunction()) && allSimple(apply.getArgs());
        }
        if (node instanceof EBinary) {
            return isSimple(((EBinary) node).getLeft()) && isSimple(((EBinary) node).getRight());
        }
        if (node instanceof EUnary) {
            EUnary unary = (EUnary) node;
            return !unary.getOperator().isMutating() && isSimple(unary.getOperand());
        }
        if (node instanceof ERange) {
            ERange range = (ERange) node;
            return isSimple(range.getFirst()) && isSimple(range.getLast())
                    && (range.getStep() == null || isSimple(range.getStep()));
        }
        if (node instanceof EBlock) {
            EBlock block = (EBlock) node;
            return block.size() == 1 && isSimple(block.getStatements().get(0));
        }
        return false;
    }

    private static boolean allSimple(List<ElixirNode> nodes) {
        for (ElixirNode node : nodes) {
            if (!isSimple(node)) return false;
        }
        return true;
    }

    private static boolean pairsSimple(List<EKeywordPair> pairs) {
        for (EKeywordPair pair : pairs) {
            if (!isSimple(pair.getValue())) return false;
        }
        return true;
    }

    // ============ 模块/定义 ============

    @Override
    public Void visitModule(EModule node, PrinterContext ctx) {
        ctx.append("defmodule ");
        ctx.append(node.getName());
        ctx.append(" do");
        ctx.newLine();
        ctx.indent();
        List<ElixirNode> body = node.getBody();
        for (int i = 0; i < body.size(); i++) {
            ElixirNode item = body.get(i);
            if (i > 0) {
                // 定义之间空一行，连续的指令/属性紧挨着
                if (item instanceof EDef || body.get(i - 1) instanceof EDef) {
                    ctx.blankLine();
                } else {
                    ctx.newLine();
                }
            }
            expr(item, ctx);
        }
        if (!body.isEmpty()) ctx.newLine();
        ctx.dedent();
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitDef(EDef node, PrinterContext ctx) {
        ctx.append(node.getKind().getKeyword());
        ctx.append(" ");
        ctx.append(node.getName());
        ctx.append("(");
        patterns(node.getParams(), ctx);
        ctx.append(")");
        if (node.getGuard() != null) {
            ctx.append(" when ");
            expr(node.getGuard(), ctx);
        }
        ElixirNode body = node.getBody();
        if (body == null || isSimple(body)) {
            ctx.append(", do: ");
            if (body == null) {
                ctx.append("nil");
            } else {
                expr(body, ctx);
            }
            return null;
        }
        doBlock(body, ctx);
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitAttribute(EAttribute node, PrinterContext ctx) {
        ctx.append("@");
        ctx.append(node.getName());
        if (node.getValue() != null) {
            ctx.append(" ");
            expr(node.getValue(), ctx);
        }
        return null;
    }

    @Override
    public Void visitDirective(EDirective node, PrinterContext ctx) {
        ctx.append(node.getKind().getKeyword());
        ctx.append(" ");
        ctx.append(node.getModule());
        return null;
    }

    // ============ 控制结构 ============

    @Override
    public Void visitIf(EIf node, PrinterContext ctx) {
        ElixirNode then = node.getThenBranch() != null ? node.getThenBranch() : new ENil(node.getLocation());
        ElixirNode els = node.getElseBranch();
        if (isSimple(node.getCondition()) && isSimple(then) && (els == null || isSimple(els))) {
            ctx.append("if ");
            expr(node.getCondition(), ctx);
            ctx.append(", do: ");
            expr(then, ctx);
            if (els != null) {
                ctx.append(", else: ");
                expr(els, ctx);
            }
            return null;
        }
        ctx.append("if ");
        arg(node.getCondition(), ctx);
        doBlock(then, ctx);
        if (els != null) {
            ctx.append("else");
            ctx.newLine();
            indentedBody(els, ctx);
        }
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitCase(ECase node, PrinterContext ctx) {
        ctx.append("case ");
        arg(node.getSubject(), ctx);
        ctx.append(" do");
        ctx.newLine();
        caseClauses(node.getClauses(), ctx);
        ctx.append("end");
        return null;
    }

    /** 缩进的子句列表，每条之后换行 */
    private void caseClauses(List<ECaseClause> clauses, PrinterContext ctx) {
        if (clauses.isEmpty()) {
            throw new InternalCompilerError(STAGE, "clause list must not be empty", null);
        }
        ctx.indent();
        for (ECaseClause clause : clauses) {
            pattern(clause.getPattern(), ctx);
            if (clause.getGuard() != null) {
                ctx.append(" when ");
                expr(clause.getGuard(), ctx);
            }
            arrowBody(clause.getBody(), ctx);
            ctx.newLine();
        }
        ctx.dedent();
    }

    @Override
    public Void visitCond(ECond node, PrinterContext ctx) {
        if (node.getClauses().isEmpty()) {
            throw new InternalCompilerError(STAGE, "cond without clauses", node);
        }
        ctx.append("cond do");
        ctx.newLine();
        ctx.indent();
        for (ECondClause clause : node.getClauses()) {
            arg(clause.getCondition(), ctx);
            arrowBody(clause.getBody(), ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitTry(ETry node, PrinterContext ctx) {
        ctx.append("try");
        doBlock(node.getBody(), ctx);
        if (!node.getRescueClauses().isEmpty()) {
            ctx.append("rescue");
            ctx.newLine();
            ctx.indent();
            for (ERescueClause clause : node.getRescueClauses()) {
                rescueHead(clause, ctx);
                arrowBody(clause.getBody(), ctx);
                ctx.newLine();
            }
            ctx.dedent();
        }
        if (!node.getCatchClauses().isEmpty()) {
            ctx.append("catch");
            ctx.newLine();
            ctx.indent();
            for (ECatchClause clause : node.getCatchClauses()) {
                if (clause.getKind() != null) {
                    pattern(clause.getKind(), ctx);
                    ctx.append(", ");
                }
                pattern(clause.getPattern(), ctx);
                if (clause.getGuard() != null) {
                    ctx.append(" when ");
                    expr(clause.getGuard(), ctx);
                }
                arrowBody(clause.getBody(), ctx);
                ctx.newLine();
            }
            ctx.dedent();
        }
        if (!node.getElseClauses().isEmpty()) {
            ctx.append("else");
            ctx.newLine();
            caseClauses(node.getElseClauses(), ctx);
        }
        if (node.getAfter() != null) {
            ctx.append("after");
            ctx.newLine();
            indentedBody(node.getAfter(), ctx);
        }
        ctx.append("end");
        return null;
    }

    private void rescueHead(ERescueClause clause, PrinterContext ctx) {
        List<String> modules = clause.getExceptionModules();
        String variable = clause.getVariable();
        String moduleText = null;
        if (modules.size() == 1) {
            moduleText = modules.get(0);
        } else if (modules.size() > 1) {
            moduleText = "[" + String.join(", ", modules) + "]";
        }
        if (variable == null) {
            ctx.append(moduleText != null ? moduleText : "_");
        } else {
            ctx.append(variable);
            if (moduleText != null) {
                ctx.append(" in ");
                ctx.append(moduleText);
            }
        }
    }

    @Override
    public Void visitWith(EWith node, PrinterContext ctx) {
        ctx.append("with ");
        List<EWithClause> clauses = node.getClauses();
        for (int i = 0; i < clauses.size(); i++) {
            if (i > 0) ctx.append(", ");
            pattern(clauses.get(i).getPattern(), ctx);
            ctx.append(" <- ");
            arg(clauses.get(i).getValue(), ctx);
        }
        doBlock(node.getBody(), ctx);
        if (!node.getElseClauses().isEmpty()) {
            ctx.append("else");
            ctx.newLine();
            caseClauses(node.getElseClauses(), ctx);
        }
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitReceive(EReceive node, PrinterContext ctx) {
        ctx.append("receive do");
        ctx.newLine();
        if (!node.getClauses().isEmpty()) {
            caseClauses(node.getClauses(), ctx);
        }
        if (node.getAfterTimeout() != null) {
            ctx.append("after");
            ctx.newLine();
            ctx.indent();
            expr(node.getAfterTimeout(), ctx);
            arrowBody(node.getAfterBody(), ctx);
            ctx.newLine();
            ctx.dedent();
        }
        ctx.append("end");
        return null;
    }

    /**
     * 循环占位打印为自引用匿名函数的不动点：条件成立时执行体并递归，否则返回 :ok。
     */
    @Override
    public Void visitWhileLoop(EWhileLoop node, PrinterContext ctx) {
        String loop = names.fresh("while_loop");
        String recurse = loop + ".(" + loop + ")";
        ctx.append("(fn ->");
        ctx.newLine();
        ctx.indent();
        ctx.append(loop + " = fn " + loop + " ->");
        ctx.newLine();
        ctx.indent();
        ctx.append("if ");
        arg(node.getCondition(), ctx);
        ctx.append(" do");
        ctx.newLine();
        ctx.indent();
        List<ElixirNode> stmts = new ArrayList<>();
        flatten(node.getBody(), stmts);
        if (!stmts.isEmpty()) {
            printStatements(stmts, ctx);
            ctx.newLine();
        }
        ctx.append(recurse);
        ctx.newLine();
        ctx.dedent();
        ctx.append("else");
        ctx.newLine();
        ctx.indent();
        ctx.append(":ok");
        ctx.newLine();
        ctx.dedent();
        ctx.append("end");
        ctx.newLine();
        ctx.dedent();
        ctx.append("end");
        ctx.newLine();
        ctx.append(recurse);
        ctx.newLine();
        ctx.dedent();
        ctx.append("end).()");
        return null;
    }

    // ============ 数据 ============

    @Override
    public Void visitList(EList node, PrinterContext ctx) {
        ctx.append("[");
        args(node.getElements(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitTuple(ETuple node, PrinterContext ctx) {
        ctx.append("{");
        args(node.getElements(), ctx);
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitMap(EMap node, PrinterContext ctx) {
        ctx.append("%{");
        if (node.getBase() != null) {
            arg(node.getBase(), ctx);
            ctx.append(" | ");
        }
        boolean keyword = true;
        for (EMapEntry entry : node.getEntries()) {
            if (!(entry.getKey() instanceof EAtom) || !ElixirStringUtils.isBareAtom(((EAtom) entry.getKey()).getName())) {
                keyword = false;
                break;
            }
        }
        List<EMapEntry> entries = node.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) ctx.append(", ");
            EMapEntry entry = entries.get(i);
            if (keyword) {
                ctx.append(((EAtom) entry.getKey()).getName() + ": ");
            } else {
                arg(entry.getKey(), ctx);
                ctx.append(" => ");
            }
            arg(entry.getValue(), ctx);
        }
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitKeywordList(EKeywordList node, PrinterContext ctx) {
        ctx.append("[");
        keywordPairs(node.getPairs(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitStruct(EStruct node, PrinterContext ctx) {
        ctx.append("%");
        if (node.getModule() != null) ctx.append(node.getModule());
        ctx.append("{");
        if (node.getBase() != null) {
            arg(node.getBase(), ctx);
            ctx.append(" | ");
        }
        keywordPairs(node.getFields(), ctx);
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitBitString(EBitString node, PrinterContext ctx) {
        ctx.append("<<");
        List<EBitSegment> segments = node.getSegments();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) ctx.append(", ");
            arg(segments.get(i).getValue(), ctx);
            segmentModifiers(segments.get(i).getSize(), segments.get(i).getType(), ctx);
        }
        ctx.append(">>");
        return null;
    }

    private void segmentModifiers(ElixirNode size, String type, PrinterContext ctx) {
        if (size == null && type == null) return;
        ctx.append("::");
        if (type != null) {
            ctx.append(type);
            if (size != null) ctx.append("-");
        }
        if (size != null) {
            ctx.append("size(");
            expr(size, ctx);
            ctx.append(")");
        }
    }

    // ============ 调用与运算 ============

    @Override
    public Void visitCall(ECall node, PrinterContext ctx) {
        ctx.append(node.getName());
        if (BARE_MACROS.contains(node.getName()) && !node.getArgs().isEmpty()) {
            ctx.append(" ");
            args(node.getArgs(), ctx);
            return null;
        }
        ctx.append("(");
        args(node.getArgs(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitRemoteCall(ERemoteCall node, PrinterContext ctx) {
        ElixirNode module = node.getModule();
        boolean bare = module instanceof EAlias || module instanceof EAtom || module instanceof EVar
                || module instanceof EField;
        parenthesized(module, !bare, ctx);
        ctx.append(".");
        ctx.append(node.getFunction());
        ctx.append("(");
        args(node.getArgs(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitApply(EApply node, PrinterContext ctx) {
        ElixirNode function = node.getFunction();
        parenthesized(function, !(function instanceof EVar || function instanceof EField), ctx);
        ctx.append(".(");
        args(node.getArgs(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitBinary(EBinary node, PrinterContext ctx) {
        BinaryOp op = node.getOperator();
        if (op.isFunction()) {
            // 取余、整除与位运算没有中缀形式
            ctx.append(op.getToken());
            ctx.append("(");
            operand(node.getLeft(), op, false, ctx);
            ctx.append(", ");
            operand(node.getRight(), op, true, ctx);
            ctx.append(")");
            return null;
        }
        operand(node.getLeft(), op, false, ctx);
        ctx.append(" ");
        ctx.append(op.getToken());
        ctx.append(" ");
        operand(node.getRight(), op, true, ctx);
        return null;
    }

    private void operand(ElixirNode child, BinaryOp parent, boolean right, PrinterContext ctx) {
        parenthesized(child, operandNeedsParens(child, parent, right), ctx);
    }

    private static boolean operandNeedsParens(ElixirNode child, BinaryOp parent, boolean right) {
        if (isControl(child) || child instanceof EMatch || child instanceof EAssign) return true;
        if (child instanceof ERange) return parent != BinaryOp.IN;
        if (!isInfix(child)) return false;
        BinaryOp op = ((EBinary) child).getOperator();
        if (op == BinaryOp.SUB) return true;
        if (parent.isFunction()) return false;
        if (op.getPrecedence() != parent.getPrecedence()) return op.getPrecedence() < parent.getPrecedence();
        return parent.isRightAssociative() ? !right : right;
    }

    @Override
    public Void visitUnary(EUnary node, PrinterContext ctx) {
        switch (node.getOperator()) {
            case BNOT:
                ctx.append(node.getOperator().getToken());
                ctx.append("(");
                arg(node.getOperand(), ctx);
                ctx.append(")");
                return null;
            case PRE_INCREMENT:
            case POST_INCREMENT:
            case PRE_DECREMENT:
            case POST_DECREMENT:
                expr(incrementAsRebinding(node), ctx);
                return null;
            default:
                ctx.append(node.getOperator().getToken());
                ElixirNode operand = node.getOperand();
                boolean negativeLiteral = operand instanceof ELiteral && ((ELiteral) operand).getValue() instanceof Number
                        && ((Number) ((ELiteral) operand).getValue()).doubleValue() < 0;
                boolean parens = isInfix(operand) || operand instanceof EUnary || isControl(operand)
                        || operand instanceof EMatch || operand instanceof EAssign || operand instanceof ERange
                        || negativeLiteral;
                parenthesized(operand, parens, ctx);
                return null;
        }
    }

    /** 未降级的自增/自减：变量上打印为重新绑定，其他位置只打印新值 */
    private static ElixirNode incrementAsRebinding(EUnary node) {
        BinaryOp op = node.getOperator().isIncrement() ? BinaryOp.ADD : BinaryOp.SUB;
        ElixirNode operand = node.getOperand();
        EBinary next = new EBinary(node.getLocation(), op, operand, ELiteral.ofInt(1));
        if (operand instanceof EVar) {
            EVar var = (EVar) operand;
            return new EMatch(node.getLocation(), new PVar(var.getLocation(), var.getName(), var.getSourceId()), next);
        }
        return next;
    }

    @Override
    public Void visitField(EField node, PrinterContext ctx) {
        accessTarget(node.getTarget(), ctx);
        ctx.append(".");
        ctx.append(node.getField());
        return null;
    }

    @Override
    public Void visitAccess(EAccess node, PrinterContext ctx) {
        accessTarget(node.getTarget(), ctx);
        ctx.append("[");
        expr(node.getKey(), ctx);
        ctx.append("]");
        return null;
    }

    private void accessTarget(ElixirNode target, PrinterContext ctx) {
        boolean bare = target instanceof EVar || target instanceof EField || target instanceof EAccess
                || target instanceof ECall || target instanceof ERemoteCall || target instanceof EApply
                || target instanceof EAlias || target instanceof EAtom || target instanceof EMap
                || target instanceof EStruct || target instanceof EParen;
        parenthesized(target, !bare, ctx);
    }

    @Override
    public Void visitRange(ERange node, PrinterContext ctx) {
        rangePart(node.getFirst(), ctx);
        ctx.append("..");
        rangePart(node.getLast(), ctx);
        if (node.getStep() != null) {
            ctx.append("//");
            rangePart(node.getStep(), ctx);
        }
        return null;
    }

    private void rangePart(ElixirNode part, PrinterContext ctx) {
        parenthesized(part, isInfix(part) || isControl(part) || part instanceof EMatch, ctx);
    }

    /**
     * 表达式位置的块：空块为 nil，单语句块为该语句，多语句块为立即调用的匿名函数
     */
    @Override
    public Void visitBlock(EBlock node, PrinterContext ctx) {
        List<ElixirNode> stmts = new ArrayList<>();
        flatten(node, stmts);
        if (stmts.isEmpty()) {
            ctx.append("nil");
            return null;
        }
        if (stmts.size() == 1) {
            expr(stmts.get(0), ctx);
            return null;
        }
        ctx.append("(fn ->");
        ctx.newLine();
        ctx.indent();
        printStatements(stmts, ctx);
        ctx.newLine();
        ctx.dedent();
        ctx.append("end).()");
        return null;
    }

    @Override
    public Void visitParen(EParen node, PrinterContext ctx) {
        ctx.append("(");
        expr(node.getExpr(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitMatch(EMatch node, PrinterContext ctx) {
        pattern(node.getPattern(), ctx);
        ctx.append(" = ");
        expr(node.getValue(), ctx);
        return null;
    }

    /**
     * 未降级的命令式赋值打印为重新绑定或结构更新
     */
    @Override
    public Void visitAssign(EAssign node, PrinterContext ctx) {
        ElixirNode target = node.getTarget();
        ElixirNode value = node.getValue();
        if (node.getOperator() != null) {
            value = new EBinary(node.getLocation(), node.getOperator(), target, value);
        }
        if (target instanceof EVar) {
            ctx.append(((EVar) target).getName());
            ctx.append(" = ");
            expr(value, ctx);
            return null;
        }
        ElixirNode updated;
        ElixirNode receiver;
        if (target instanceof EField) {
            receiver = ((EField) target).getTarget();
            updated = new EMap(node.getLocation(), receiver, Collections.singletonList(
                    new EMapEntry(new EAtom(target.getLocation(), ((EField) target).getField()), value)));
        } else if (target instanceof EAccess) {
            receiver = ((EAccess) target).getTarget();
            updated = new ERemoteCall(node.getLocation(), new EAlias(node.getLocation(), "List"), "replace_at",
                    Arrays.asList(receiver, ((EAccess) target).getKey(), value));
        } else {
            throw new InternalCompilerError(STAGE, "unsupported assignment target", target);
        }
        if (receiver instanceof EVar) {
            ctx.append(((EVar) receiver).getName());
            ctx.append(" = ");
        }
        expr(updated, ctx);
        return null;
    }

    @Override
    public Void visitFn(EFn node, PrinterContext ctx) {
        List<EFnClause> clauses = node.getClauses();
        if (clauses.isEmpty()) {
            throw new InternalCompilerError(STAGE, "anonymous function without clauses", node);
        }
        if (clauses.size() == 1) {
            EFnClause clause = clauses.get(0);
            ctx.append("fn");
            fnHead(clause, ctx);
            if (clause.getBody() == null || isSimple(clause.getBody())) {
                arrowBody(clause.getBody(), ctx);
                ctx.append(" end");
            } else {
                arrowBody(clause.getBody(), ctx);
                ctx.newLine();
                ctx.append("end");
            }
            return null;
        }
        ctx.append("fn");
        ctx.newLine();
        ctx.indent();
        for (EFnClause clause : clauses) {
            fnHead(clause, ctx);
            arrowBody(clause.getBody(), ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("end");
        return null;
    }

    /** 参数与守卫，前面带一个空格 */
    private void fnHead(EFnClause clause, PrinterContext ctx) {
        if (!clause.getParams().isEmpty()) {
            ctx.append(" ");
            patterns(clause.getParams(), ctx);
        }
        if (clause.getGuard() != null) {
            ctx.append(" when ");
            expr(clause.getGuard(), ctx);
        }
    }

    @Override
    public Void visitFor(EFor node, PrinterContext ctx) {
        if (node.getGenerators().isEmpty()) {
            throw new InternalCompilerError(STAGE, "comprehension without generators", node);
        }
        ctx.append("for ");
        List<EForGenerator> generators = node.getGenerators();
        for (int i = 0; i < generators.size(); i++) {
            if (i > 0) ctx.append(", ");
            pattern(generators.get(i).getPattern(), ctx);
            ctx.append(" <- ");
            arg(generators.get(i).getSource(), ctx);
        }
        for (ElixirNode filter : node.getFilters()) {
            ctx.append(", ");
            arg(filter, ctx);
        }
        if (node.getInto() != null) {
            ctx.append(", into: ");
            arg(node.getInto(), ctx);
        }
        if (isSimple(node.getBody())) {
            ctx.append(", do: ");
            expr(node.getBody(), ctx);
            return null;
        }
        doBlock(node.getBody(), ctx);
        ctx.append("end");
        return null;
    }

    // ============ 叶节点 ============

    @Override
    public Void visitRaw(ERaw node, PrinterContext ctx) {
        String[] lines = node.getCode().split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) ctx.newLine();
            ctx.append(lines[i]);
        }
        return null;
    }

    @Override
    public Void visitVar(EVar node, PrinterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitLiteral(ELiteral node, PrinterContext ctx) {
        ctx.append(literal(node));
        return null;
    }

    static String literal(ELiteral node) {
        Object value = node.getValue();
        if (node.getKind() == null) {
            throw new InternalCompilerError(STAGE, "literal without kind", node);
        }
        switch (node.getKind()) {
            case INTEGER:
                if (value instanceof Number) return Long.toString(((Number) value).longValue());
                break;
            case FLOAT:
                if (value instanceof Number) {
                    double d = ((Number) value).doubleValue();
                    if (Double.isNaN(d) || Double.isInfinite(d)) {
                        throw new InternalCompilerError(STAGE, "float literal is not representable: " + d, node);
                    }
                    return Double.toString(d).replace('E', 'e');
                }
                break;
            case STRING:
                if (value instanceof String) return ElixirStringUtils.quote((String) value);
                break;
            case BOOLEAN:
                if (value instanceof Boolean) return value.toString();
                break;
            default:
                break;
        }
        throw new InternalCompilerError(STAGE, "unsupported literal " + node.getKind() + ": " + value, node);
    }

    @Override
    public Void visitAtom(EAtom node, PrinterContext ctx) {
        ctx.append(ElixirStringUtils.atom(node.getName()));
        return null;
    }

    @Override
    public Void visitAlias(EAlias node, PrinterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitNil(ENil node, PrinterContext ctx) {
        ctx.append("nil");
        return null;
    }

    @Override
    public Void visitUnderscore(EUnderscore node, PrinterContext ctx) {
        ctx.append("_");
        return null;
    }

    // ============ 模式 ============

    private final class PatternPrinter implements PatternVisitor<Void, PrinterContext> {

        @Override
        public Void visitVar(PVar p, PrinterContext ctx) {
            ctx.append(p.getName());
            return null;
        }

        @Override
        public Void visitLiteral(PLiteral p, PrinterContext ctx) {
            expr(p.getValue(), ctx);
            return null;
        }

        @Override
        public Void visitTuple(PTuple p, PrinterContext ctx) {
            ctx.append("{");
            patterns(p.getElements(), ctx);
            ctx.append("}");
            return null;
        }

        @Override
        public Void visitList(PList p, PrinterContext ctx) {
            ctx.append("[");
            patterns(p.getElements(), ctx);
            ctx.append("]");
            return null;
        }

        @Override
        public Void visitCons(PCons p, PrinterContext ctx) {
            if (p.getHeads().isEmpty()) {
                throw new InternalCompilerError(STAGE, "cons pattern without heads", p);
            }
            ctx.append("[");
            patterns(p.getHeads(), ctx);
            ctx.append(" | ");
            pattern(p.getTail(), ctx);
            ctx.append("]");
            return null;
        }

        @Override
        public Void visitMap(PMap p, PrinterContext ctx) {
            boolean keyword = true;
            for (PMapEntry entry : p.getEntries()) {
                if (!(entry.getKey() instanceof EAtom) || !ElixirStringUtils.isBareAtom(((EAtom) entry.getKey()).getName())) {
                    keyword = false;
                    break;
                }
            }
            ctx.append("%{");
            List<PMapEntry> entries = p.getEntries();
            for (int i = 0; i < entries.size(); i++) {
                if (i > 0) ctx.append(", ");
                if (keyword) {
                    ctx.append(((EAtom) entries.get(i).getKey()).getName() + ": ");
                } else {
                    expr(entries.get(i).getKey(), ctx);
                    ctx.append(" => ");
                }
                pattern(entries.get(i).getValue(), ctx);
            }
            ctx.append("}");
            return null;
        }

        @Override
        public Void visitStruct(PStruct p, PrinterContext ctx) {
            ctx.append("%");
            ctx.append(p.getModule());
            ctx.append("{");
            List<PFieldPattern> fields = p.getFields();
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) ctx.append(", ");
                ctx.append(ElixirStringUtils.keywordKey(fields.get(i).getField()));
                ctx.append(" ");
                pattern(fields.get(i).getPattern(), ctx);
            }
            ctx.append("}");
            return null;
        }

        @Override
        public Void visitPin(PPin p, PrinterContext ctx) {
            ctx.append("^");
            ctx.append(p.getName());
            return null;
        }

        @Override
        public Void visitWildcard(PWildcard p, PrinterContext ctx) {
            ctx.append(p.render());
            return null;
        }

        @Override
        public Void visitBinary(PBinary p, PrinterContext ctx) {
            ctx.append("<<");
            List<PBinarySegment> segments = p.getSegments();
            for (int i = 0; i < segments.size(); i++) {
                if (i > 0) ctx.append(", ");
                pattern(segments.get(i).getPattern(), ctx);
                segmentModifiers(segments.get(i).getSize(), segments.get(i).getType(), ctx);
            }
            ctx.append(">>");
            return null;
        }
    }
}
