package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * 一元运算（自增/自减区分前缀与后缀）
 */
public class TUnop extends TypedExpr {
    private final TUnaryOp operator;
    private final boolean postfix;
    private final TypedExpr operand;

    public TUnop(SourceLocation location, TypeRef type, TUnaryOp operator, boolean postfix, TypedExpr operand) {
        super(location, type);
        this.operator = operator;
        this.postfix = postfix;
        this.operand = operand;
    }

    public TUnop(TUnaryOp operator, boolean postfix, TypedExpr operand) {
        this(SourceLocation.UNKNOWN, operand.getType(), operator, postfix, operand);
    }

    public TUnaryOp getOperator() {
        return operator;
    }

    public boolean isPostfix() {
        return postfix;
    }

    public TypedExpr getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitUnop(this, context);
    }

    public enum TUnaryOp {
        INCREMENT,
        DECREMENT,
        NOT,
        NEG,
        NEG_BITS
    }
}
