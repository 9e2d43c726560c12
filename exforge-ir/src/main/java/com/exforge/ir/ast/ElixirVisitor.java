package com.exforge.ir.ast;

import com.exforge.ir.ast.control.*;
import com.exforge.ir.ast.data.*;
import com.exforge.ir.ast.decl.*;
import com.exforge.ir.ast.expr.*;

/**
 * 中间 AST 访问者接口，每个节点变体一个 visit 方法。
 * <p>
 * 新增变体必须在这里加方法，从而强制重写组合子、子节点枚举和打印器同步扩展。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface ElixirVisitor<R, C> {

    // ===== 模块/定义 (4) =====
    R visitModule(EModule node, C context);
    R visitDef(EDef node, C context);
    R visitAttribute(EAttribute node, C context);
    R visitDirective(EDirective node, C context);

    // ===== 控制结构 (7) =====
    R visitIf(EIf node, C context);
    R visitCase(ECase node, C context);
    R visitCond(ECond node, C context);
    R visitTry(ETry node, C context);
    R visitWith(EWith node, C context);
    R visitReceive(EReceive node, C context);
    R visitWhileLoop(EWhileLoop node, C context);

    // ===== 数据字面量 (6) =====
    R visitList(EList node, C context);
    R visitTuple(ETuple node, C context);
    R visitMap(EMap node, C context);
    R visitKeywordList(EKeywordList node, C context);
    R visitStruct(EStruct node, C context);
    R visitBitString(EBitString node, C context);

    // ===== 表达式/绑定 (15) =====
    R visitCall(ECall node, C context);
    R visitRemoteCall(ERemoteCall node, C context);
    R visitApply(EApply node, C context);
    R visitBinary(EBinary node, C context);
    R visitUnary(EUnary node, C context);
    R visitField(EField node, C context);
    R visitAccess(EAccess node, C context);
    R visitRange(ERange node, C context);
    R visitBlock(EBlock node, C context);
    R visitParen(EParen node, C context);
    R visitMatch(EMatch node, C context);
    R visitAssign(EAssign node, C context);
    R visitFn(EFn node, C context);
    R visitFor(EFor node, C context);
    R visitRaw(ERaw node, C context);

    // ===== 叶节点 (6) =====
    R visitVar(EVar node, C context);
    R visitLiteral(ELiteral node, C context);
    R visitAtom(EAtom node, C context);
    R visitAlias(EAlias node, C context);
    R visitNil(ENil node, C context);
    R visitUnderscore(EUnderscore node, C context);
}
