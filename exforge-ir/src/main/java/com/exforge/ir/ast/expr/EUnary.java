package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;
import com.exforge.ir.ast.UnaryOp;

/**
 * 一元运算
 */
public class EUnary extends ElixirNode {
    private final UnaryOp operator;
    private final ElixirNode operand;

    public EUnary(SourceLocation location, UnaryOp operator, ElixirNode operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public ElixirNode getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitUnary(this, context);
    }
}
