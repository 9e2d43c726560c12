package com.exforge.ir.ast;

import com.exforge.ir.ast.control.*;
import com.exforge.ir.ast.data.*;
import com.exforge.ir.ast.decl.*;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.*;

import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * 结构相等：节点变体、运算符、名字、字面量和所有子树逐一相同。
 * <p>
 * 忽略源码位置、元数据和源绑定 id；整数字面量按数值比较。
 */
public final class StructuralEquality {

    private static final NodeComparer NODES = new NodeComparer();
    private static final PatternComparer PATTERNS = new PatternComparer();

    private StructuralEquality() {
    }

    public static boolean equal(ElixirNode a, ElixirNode b) {
        if (a == b) return true;
        if (a == null || b == null || a.getClass() != b.getClass()) return false;
        return a.accept(NODES, b);
    }

    public static boolean equal(ElixirPattern a, ElixirPattern b) {
        if (a == b) return true;
        if (a == null || b == null || a.getClass() != b.getClass()) return false;
        return a.accept(PATTERNS, b);
    }

    private static boolean nodes(List<? extends ElixirNode> a, List<? extends ElixirNode> b) {
        return StructuralEquality.<ElixirNode>all(a, b, StructuralEquality::equal);
    }

    private static boolean patterns(List<? extends ElixirPattern> a, List<? extends ElixirPattern> b) {
        return StructuralEquality.<ElixirPattern>all(a, b, StructuralEquality::equal);
    }

    private static <T> boolean all(List<? extends T> a, List<? extends T> b, BiPredicate<T, T> same) {
        if (a == null || b == null) return a == b;
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (!same.test(a.get(i), b.get(i))) return false;
        }
        return true;
    }

    private static boolean literalValues(ELiteral a, ELiteral b) {
        if (a.getKind() != b.getKind()) return false;
        Object x = a.getValue();
        Object y = b.getValue();
        if (x instanceof Number && y instanceof Number) {
            if (a.getKind() == ELiteral.LiteralKind.INTEGER) {
                return ((Number) x).longValue() == ((Number) y).longValue();
            }
            return Double.compare(((Number) x).doubleValue(), ((Number) y).doubleValue()) == 0;
        }
        return Objects.equals(x, y);
    }

    // ==================== 子句 ====================

    private static boolean caseClause(ECaseClause a, ECaseClause b) {
        return equal(a.getPattern(), b.getPattern()) && equal(a.getGuard(), b.getGuard())
                && equal(a.getBody(), b.getBody());
    }

    private static boolean condClause(ECondClause a, ECondClause b) {
        return equal(a.getCondition(), b.getCondition()) && equal(a.getBody(), b.getBody());
    }

    private static boolean withClause(EWithClause a, EWithClause b) {
        return equal(a.getPattern(), b.getPattern()) && equal(a.getValue(), b.getValue());
    }

    private static boolean rescueClause(ERescueClause a, ERescueClause b) {
        return Objects.equals(a.getVariable(), b.getVariable())
                && Objects.equals(a.getExceptionModules(), b.getExceptionModules())
                && equal(a.getBody(), b.getBody());
    }

    private static boolean catchClause(ECatchClause a, ECatchClause b) {
        return equal(a.getKind(), b.getKind()) && equal(a.getPattern(), b.getPattern())
                && equal(a.getGuard(), b.getGuard()) && equal(a.getBody(), b.getBody());
    }

    private static boolean fnClause(EFnClause a, EFnClause b) {
        return patterns(a.getParams(), b.getParams()) && equal(a.getGuard(), b.getGuard())
                && equal(a.getBody(), b.getBody());
    }

    private static boolean generator(EForGenerator a, EForGenerator b) {
        return equal(a.getPattern(), b.getPattern()) && equal(a.getSource(), b.getSource());
    }

    private static boolean mapEntry(EMapEntry a, EMapEntry b) {
        return equal(a.getKey(), b.getKey()) && equal(a.getValue(), b.getValue());
    }

    private static boolean keywordPair(EKeywordPair a, EKeywordPair b) {
        return Objects.equals(a.getKey(), b.getKey()) && equal(a.getValue(), b.getValue());
    }

    private static boolean bitSegment(EBitSegment a, EBitSegment b) {
        return equal(a.getValue(), b.getValue()) && equal(a.getSize(), b.getSize())
                && Objects.equals(a.getType(), b.getType());
    }

    /**
     * 调用方已保证 other 与 node 同类
     */
    private static final class NodeComparer implements ElixirVisitor<Boolean, ElixirNode> {

        @Override
        public Boolean visitModule(EModule node, ElixirNode other) {
            EModule o = (EModule) other;
            return node.getName().equals(o.getName()) && nodes(node.getBody(), o.getBody());
        }

        @Override
        public Boolean visitDef(EDef node, ElixirNode other) {
            EDef o = (EDef) other;
            return node.getKind() == o.getKind() && node.getName().equals(o.getName())
                    && patterns(node.getParams(), o.getParams())
                    && equal(node.getGuard(), o.getGuard()) && equal(node.getBody(), o.getBody());
        }

        @Override
        public Boolean visitAttribute(EAttribute node, ElixirNode other) {
            EAttribute o = (EAttribute) other;
            return node.getName().equals(o.getName()) && equal(node.getValue(), o.getValue());
        }

        @Override
        public Boolean visitDirective(EDirective node, ElixirNode other) {
            EDirective o = (EDirective) other;
            return node.getKind() == o.getKind() && Objects.equals(node.getModule(), o.getModule());
        }

        @Override
        public Boolean visitIf(EIf node, ElixirNode other) {
            EIf o = (EIf) other;
            return equal(node.getCondition(), o.getCondition()) && equal(node.getThenBranch(), o.getThenBranch())
                    && equal(node.getElseBranch(), o.getElseBranch());
        }

        @Override
        public Boolean visitCase(ECase node, ElixirNode other) {
            ECase o = (ECase) other;
            return equal(node.getSubject(), o.getSubject())
                    && all(node.getClauses(), o.getClauses(), StructuralEquality::caseClause);
        }

        @Override
        public Boolean visitCond(ECond node, ElixirNode other) {
            return all(node.getClauses(), ((ECond) other).getClauses(), StructuralEquality::condClause);
        }

        @Override
        public Boolean visitTry(ETry node, ElixirNode other) {
            ETry o = (ETry) other;
            return equal(node.getBody(), o.getBody())
                    && all(node.getRescueClauses(), o.getRescueClauses(), StructuralEquality::rescueClause)
                    && all(node.getCatchClauses(), o.getCatchClauses(), StructuralEquality::catchClause)
                    && all(node.getElseClauses(), o.getElseClauses(), StructuralEquality::caseClause)
                    && equal(node.getAfter(), o.getAfter());
        }

        @Override
        public Boolean visitWith(EWith node, ElixirNode other) {
            EWith o = (EWith) other;
            return all(node.getClauses(), o.getClauses(), StructuralEquality::withClause)
                    && equal(node.getBody(), o.getBody())
                    && all(node.getElseClauses(), o.getElseClauses(), StructuralEquality::caseClause);
        }

        @Override
        public Boolean visitReceive(EReceive node, ElixirNode other) {
            EReceive o = (EReceive) other;
            return all(node.getClauses(), o.getClauses(), StructuralEquality::caseClause)
                    && equal(node.getAfterTimeout(), o.getAfterTimeout())
                    && equal(node.getAfterBody(), o.getAfterBody());
        }

        @Override
        public Boolean visitWhileLoop(EWhileLoop node, ElixirNode other) {
            EWhileLoop o = (EWhileLoop) other;
            return equal(node.getCondition(), o.getCondition()) && equal(node.getBody(), o.getBody());
        }

        @Override
        public Boolean visitList(EList node, ElixirNode other) {
            return nodes(node.getElements(), ((EList) other).getElements());
        }

        @Override
        public Boolean visitTuple(ETuple node, ElixirNode other) {
            return nodes(node.getElements(), ((ETuple) other).getElements());
        }

        @Override
        public Boolean visitMap(EMap node, ElixirNode other) {
            EMap o = (EMap) other;
            return equal(node.getBase(), o.getBase())
                    && all(node.getEntries(), o.getEntries(), StructuralEquality::mapEntry);
        }

        @Override
        public Boolean visitKeywordList(EKeywordList node, ElixirNode other) {
            return all(node.getPairs(), ((EKeywordList) other).getPairs(), StructuralEquality::keywordPair);
        }

        @Override
        public Boolean visitStruct(EStruct node, ElixirNode other) {
            EStruct o = (EStruct) other;
            return Objects.equals(node.getModule(), o.getModule()) && equal(node.getBase(), o.getBase())
                    && all(node.getFields(), o.getFields(), StructuralEquality::keywordPair);
        }

        @Override
        public Boolean visitBitString(EBitString node, ElixirNode other) {
            return all(node.getSegments(), ((EBitString) other).getSegments(), StructuralEquality::bitSegment);
        }

        @Override
        public Boolean visitCall(ECall node, ElixirNode other) {
            ECall o = (ECall) other;
            return node.getName().equals(o.getName()) && nodes(node.getArgs(), o.getArgs());
        }

        @Override
        public Boolean visitRemoteCall(ERemoteCall node, ElixirNode other) {
            ERemoteCall o = (ERemoteCall) other;
            return node.getFunction().equals(o.getFunction()) && equal(node.getModule(), o.getModule())
                    && nodes(node.getArgs(), o.getArgs());
        }

        @Override
        public Boolean visitApply(EApply node, ElixirNode other) {
            EApply o = (EApply) other;
            return equal(node.getFunction(), o.getFunction()) && nodes(node.getArgs(), o.getArgs());
        }

        @Override
        public Boolean visitBinary(EBinary node, ElixirNode other) {
            EBinary o = (EBinary) other;
            return node.getOperator() == o.getOperator() && equal(node.getLeft(), o.getLeft())
                    && equal(node.getRight(), o.getRight());
        }

        @Override
        public Boolean visitUnary(EUnary node, ElixirNode other) {
            EUnary o = (EUnary) other;
            return node.getOperator() == o.getOperator() && equal(node.getOperand(), o.getOperand());
        }

        @Override
        public Boolean visitField(EField node, ElixirNode other) {
            EField o = (EField) other;
            return node.getField().equals(o.getField()) && equal(node.getTarget(), o.getTarget());
        }

        @Override
        public Boolean visitAccess(EAccess node, ElixirNode other) {
            EAccess o = (EAccess) other;
            return equal(node.getTarget(), o.getTarget()) && equal(node.getKey(), o.getKey());
        }

        @Override
        public Boolean visitRange(ERange node, ElixirNode other) {
            ERange o = (ERange) other;
            return equal(node.getFirst(), o.getFirst()) && equal(node.getLast(), o.getLast())
                    && equal(node.getStep(), o.getStep());
        }

        @Override
        public Boolean visitBlock(EBlock node, ElixirNode other) {
            return nodes(node.getStatements(), ((EBlock) other).getStatements());
        }

        @Override
        public Boolean visitParen(EParen node, ElixirNode other) {
            return equal(node.getExpr(), ((EParen) other).getExpr());
        }

        @Override
        public Boolean visitMatch(EMatch node, ElixirNode other) {
            EMatch o = (EMatch) other;
            return equal(node.getPattern(), o.getPattern()) && equal(node.getValue(), o.getValue());
        }

        @Override
        public Boolean visitAssign(EAssign node, ElixirNode other) {
            EAssign o = (EAssign) other;
            return node.getOperator() == o.getOperator() && equal(node.getTarget(), o.getTarget())
                    && equal(node.getValue(), o.getValue());
        }

        @Override
        public Boolean visitFn(EFn node, ElixirNode other) {
            return all(node.getClauses(), ((EFn) other).getClauses(), StructuralEquality::fnClause);
        }

        @Override
        public Boolean visitFor(EFor node, ElixirNode other) {
            EFor o = (EFor) other;
            return all(node.getGenerators(), o.getGenerators(), StructuralEquality::generator)
                    && nodes(node.getFilters(), o.getFilters()) && equal(node.getInto(), o.getInto())
                    && equal(node.getBody(), o.getBody());
        }

        @Override
        public Boolean visitRaw(ERaw node, ElixirNode other) {
            return node.getCode().equals(((ERaw) other).getCode());
        }

        @Override
        public Boolean visitVar(EVar node, ElixirNode other) {
            return node.getName().equals(((EVar) other).getName());
        }

        @Override
        public Boolean visitLiteral(ELiteral node, ElixirNode other) {
            return literalValues(node, (ELiteral) other);
        }

        @Override
        public Boolean visitAtom(EAtom node, ElixirNode other) {
            return node.getName().equals(((EAtom) other).getName());
        }

        @Override
        public Boolean visitAlias(EAlias node, ElixirNode other) {
            return node.getName().equals(((EAlias) other).getName());
        }

        @Override
        public Boolean visitNil(ENil node, ElixirNode other) {
            return true;
        }

        @Override
        public Boolean visitUnderscore(EUnderscore node, ElixirNode other) {
            return true;
        }
    }

    private static final class PatternComparer implements PatternVisitor<Boolean, ElixirPattern> {

        @Override
        public Boolean visitVar(PVar pattern, ElixirPattern other) {
            return pattern.getName().equals(((PVar) other).getName());
        }

        @Override
        public Boolean visitLiteral(PLiteral pattern, ElixirPattern other) {
            return equal(pattern.getValue(), ((PLiteral) other).getValue());
        }

        @Override
        public Boolean visitTuple(PTuple pattern, ElixirPattern other) {
            return patterns(pattern.getElements(), ((PTuple) other).getElements());
        }

        @Override
        public Boolean visitList(PList pattern, ElixirPattern other) {
            return patterns(pattern.getElements(), ((PList) other).getElements());
        }

        @Override
        public Boolean visitCons(PCons pattern, ElixirPattern other) {
            PCons o = (PCons) other;
            return patterns(pattern.getHeads(), o.getHeads()) && equal(pattern.getTail(), o.getTail());
        }

        @Override
        public Boolean visitMap(PMap pattern, ElixirPattern other) {
            return all(pattern.getEntries(), ((PMap) other).getEntries(),
                    (x, y) -> equal(x.getKey(), y.getKey()) && equal(x.getValue(), y.getValue()));
        }

        @Override
        public Boolean visitStruct(PStruct pattern, ElixirPattern other) {
            PStruct o = (PStruct) other;
            return Objects.equals(pattern.getModule(), o.getModule())
                    && all(pattern.getFields(), o.getFields(),
                            (x, y) -> x.getField().equals(y.getField()) && equal(x.getPattern(), y.getPattern()));
        }

        @Override
        public Boolean visitPin(PPin pattern, ElixirPattern other) {
            return pattern.getName().equals(((PPin) other).getName());
        }

        @Override
        public Boolean visitWildcard(PWildcard pattern, ElixirPattern other) {
            return Objects.equals(pattern.getName(), ((PWildcard) other).getName());
        }

        @Override
        public Boolean visitBinary(PBinary pattern, ElixirPattern other) {
            return all(pattern.getSegments(), ((PBinary) other).getSegments(),
                    (x, y) -> equal(x.getPattern(), y.getPattern()) && equal(x.getSize(), y.getSize())
                            && Objects.equals(x.getType(), y.getType()));
        }
    }
}
