package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;
import com.exforge.ir.ast.BinaryOp;

/**
 * 命令式左值赋值 target = value / target op= value。
 * 只存在于可变→不可变降级之前，target 为变量、字段或下标。
 */
public class EAssign extends ElixirNode {
    private final ElixirNode target;
    private final BinaryOp operator;
    private final ElixirNode value;

    public EAssign(SourceLocation location, ElixirNode target, BinaryOp operator, ElixirNode value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public ElixirNode getTarget() {
        return target;
    }

    /** 复合赋值的运算符，普通赋值为 null */
    public BinaryOp getOperator() {
        return operator;
    }

    public ElixirNode getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitAssign(this, context);
    }
}
