package com.exforge.ir.lowering;

import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.expr.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 类型化树中的变量引用收集（按绑定 id）。
 */
public final class TypedReferences implements TypedVisitor<Void, Set<Integer>> {

    private static final TypedReferences INSTANCE = new TypedReferences();

    private TypedReferences() {
    }

    /** 子树中被引用的绑定 id */
    public static Set<Integer> referencedIds(TypedExpr expr) {
        Set<Integer> ids = new HashSet<>();
        INSTANCE.scan(expr, ids);
        return ids;
    }

    public static boolean references(TypedExpr expr, TVariable variable) {
        return referencedIds(expr).contains(variable.getId());
    }

    public static boolean referencesAny(List<TypedExpr> exprs, TVariable variable) {
        for (TypedExpr expr : exprs) {
            if (references(expr, variable)) return true;
        }
        return false;
    }

    private void scan(TypedExpr expr, Set<Integer> ids) {
        if (expr != null) expr.accept(this, ids);
    }

    private void scanAll(List<? extends TypedExpr> exprs, Set<Integer> ids) {
        for (TypedExpr expr : exprs) scan(expr, ids);
    }

    @Override
    public Void visitClassDecl(TClassDecl node, Set<Integer> ids) {
        for (TClassDecl.TMethod method : node.getMethods()) scan(method.getBody(), ids);
        return null;
    }

    @Override
    public Void visitVar(TVar node, Set<Integer> ids) {
        scan(node.getInit(), ids);
        return null;
    }

    @Override
    public Void visitFunction(TFunction node, Set<Integer> ids) {
        scan(node.getBody(), ids);
        return null;
    }

    @Override
    public Void visitBlock(TBlock node, Set<Integer> ids) {
        scanAll(node.getExprs(), ids);
        return null;
    }

    @Override
    public Void visitIf(TIf node, Set<Integer> ids) {
        scan(node.getCondition(), ids);
        scan(node.getThenExpr(), ids);
        scan(node.getElseExpr(), ids);
        return null;
    }

    @Override
    public Void visitWhile(TWhile node, Set<Integer> ids) {
        scan(node.getCondition(), ids);
        scan(node.getBody(), ids);
        return null;
    }

    @Override
    public Void visitSwitch(TSwitch node, Set<Integer> ids) {
        scan(node.getSubject(), ids);
        for (TSwitch.SwitchCase c : node.getCases()) {
            scanAll(c.getValues(), ids);
            scan(c.getBody(), ids);
        }
        scan(node.getDefaultBody(), ids);
        return null;
    }

    @Override
    public Void visitReturn(TReturn node, Set<Integer> ids) {
        scan(node.getValue(), ids);
        return null;
    }

    @Override
    public Void visitThrow(TThrow node, Set<Integer> ids) {
        scan(node.getValue(), ids);
        return null;
    }

    @Override
    public Void visitConst(TConst node, Set<Integer> ids) {
        return null;
    }

    @Override
    public Void visitLocal(TLocal node, Set<Integer> ids) {
        ids.add(node.getVariable().getId());
        return null;
    }

    @Override
    public Void visitBinop(TBinop node, Set<Integer> ids) {
        scan(node.getLeft(), ids);
        scan(node.getRight(), ids);
        return null;
    }

    @Override
    public Void visitUnop(TUnop node, Set<Integer> ids) {
        scan(node.getOperand(), ids);
        return null;
    }

    @Override
    public Void visitField(TField node, Set<Integer> ids) {
        scan(node.getTarget(), ids);
        return null;
    }

    @Override
    public Void visitCall(TCall node, Set<Integer> ids) {
        scan(node.getCallee(), ids);
        scanAll(node.getArgs(), ids);
        return null;
    }

    @Override
    public Void visitArrayAccess(TArrayAccess node, Set<Integer> ids) {
        scan(node.getTarget(), ids);
        scan(node.getIndex(), ids);
        return null;
    }

    @Override
    public Void visitArrayDecl(TArrayDecl node, Set<Integer> ids) {
        scanAll(node.getElements(), ids);
        return null;
    }

    @Override
    public Void visitObjectDecl(TObjectDecl node, Set<Integer> ids) {
        for (TObjectDecl.ObjectField field : node.getFields()) scan(field.getValue(), ids);
        return null;
    }

    @Override
    public Void visitParenthesis(TParenthesis node, Set<Integer> ids) {
        scan(node.getExpr(), ids);
        return null;
    }

    @Override
    public Void visitTypeExpr(TTypeExpr node, Set<Integer> ids) {
        return null;
    }

    @Override
    public Void visitEnumIndex(TEnumIndex node, Set<Integer> ids) {
        scan(node.getTarget(), ids);
        return null;
    }

    @Override
    public Void visitEnumParameter(TEnumParameter node, Set<Integer> ids) {
        scan(node.getTarget(), ids);
        return null;
    }

    @Override
    public Void visitMeta(TMeta node, Set<Integer> ids) {
        scan(node.getExpr(), ids);
        return null;
    }
}
