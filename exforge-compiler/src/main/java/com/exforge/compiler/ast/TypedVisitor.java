package com.exforge.compiler.ast;

import com.exforge.compiler.ast.expr.*;

/**
 * 类型化树访问者接口，每种节点一个 visit 方法。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface TypedVisitor<R, C> {

    // ===== 声明 =====
    R visitClassDecl(TClassDecl node, C context);
    R visitVar(TVar node, C context);
    R visitFunction(TFunction node, C context);

    // ===== 控制流 =====
    R visitBlock(TBlock node, C context);
    R visitIf(TIf node, C context);
    R visitWhile(TWhile node, C context);
    R visitSwitch(TSwitch node, C context);
    R visitReturn(TReturn node, C context);
    R visitThrow(TThrow node, C context);

    // ===== 表达式 =====
    R visitConst(TConst node, C context);
    R visitLocal(TLocal node, C context);
    R visitBinop(TBinop node, C context);
    R visitUnop(TUnop node, C context);
    R visitField(TField node, C context);
    R visitCall(TCall node, C context);
    R visitArrayAccess(TArrayAccess node, C context);
    R visitArrayDecl(TArrayDecl node, C context);
    R visitObjectDecl(TObjectDecl node, C context);
    R visitParenthesis(TParenthesis node, C context);
    R visitTypeExpr(TTypeExpr node, C context);
    R visitEnumIndex(TEnumIndex node, C context);
    R visitEnumParameter(TEnumParameter node, C context);
    R visitMeta(TMeta node, C context);
}
