package com.exforge.ir.lowering.patterns;

import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.expr.TBinop;
import com.exforge.compiler.ast.expr.TBinop.TBinaryOp;
import com.exforge.compiler.ast.expr.TCall;
import com.exforge.compiler.ast.expr.TConst;
import com.exforge.compiler.ast.expr.TLocal;
import com.exforge.compiler.ast.expr.TParenthesis;

/**
 * 模式共用的类型化树形状判断。全部是不抛异常的纯谓词。
 */
final class TypedShapes {

    private TypedShapes() {
    }

    static TypedExpr unparen(TypedExpr expr) {
        TypedExpr current = expr;
        while (current instanceof TParenthesis) {
            current = ((TParenthesis) current).getExpr();
        }
        return current;
    }

    static boolean isNull(TypedExpr expr) {
        TypedExpr e = unparen(expr);
        return e instanceof TConst && ((TConst) e).isNull();
    }

    /** 局部变量引用的绑定，不是引用时为 null */
    static TVariable localOf(TypedExpr expr) {
        TypedExpr e = unparen(expr);
        return e instanceof TLocal ? ((TLocal) e).getVariable() : null;
    }

    static boolean isLocal(TypedExpr expr, TVariable variable) {
        TVariable local = localOf(expr);
        return local != null && local.getId() == variable.getId();
    }

    /** receiver.name(...)，参数个数为 argCount；不符时为 null */
    static TCall methodCall(TypedExpr expr, String name, int argCount) {
        TypedExpr e = unparen(expr);
        if (!(e instanceof TCall)) return null;
        TCall call = (TCall) e;
        if (!name.equals(call.getMethodName()) || call.getArgs().size() != argCount) return null;
        return call;
    }

    /**
     * 判空条件 {@code v != null} / {@code v == null}（两侧顺序任意）中被测试的变量。
     */
    static NullTest nullTest(TypedExpr condition) {
        TypedExpr e = unparen(condition);
        if (!(e instanceof TBinop)) return null;
        TBinop test = (TBinop) e;
        if (test.getOperator() != TBinaryOp.EQ && test.getOperator() != TBinaryOp.NEQ) return null;
        TVariable tested = null;
        if (isNull(test.getRight())) tested = localOf(test.getLeft());
        else if (isNull(test.getLeft())) tested = localOf(test.getRight());
        if (tested == null) return null;
        return new NullTest(tested, test.getOperator() == TBinaryOp.NEQ);
    }

    static final class NullTest {
        final TVariable variable;
        /** true 表示 v != null */
        final boolean notNull;

        NullTest(TVariable variable, boolean notNull) {
            this.variable = variable;
            this.notNull = notNull;
        }
    }
}
