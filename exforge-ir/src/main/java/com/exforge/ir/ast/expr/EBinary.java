package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;
import com.exforge.ir.ast.BinaryOp;

/**
 * 二元运算
 */
public class EBinary extends ElixirNode {
    private final BinaryOp operator;
    private final ElixirNode left;
    private final ElixirNode right;

    public EBinary(SourceLocation location, BinaryOp operator, ElixirNode left, ElixirNode right) {
        super(location);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public ElixirNode getLeft() {
        return left;
    }

    public ElixirNode getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }
}
