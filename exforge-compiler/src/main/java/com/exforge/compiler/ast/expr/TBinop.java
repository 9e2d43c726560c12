package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * 二元运算，包括赋值、复合赋值与空值合并
 */
public class TBinop extends TypedExpr {
    private final TBinaryOp operator;
    private final TBinaryOp assignOperator;
    private final TypedExpr left;
    private final TypedExpr right;

    public TBinop(SourceLocation location, TypeRef type, TBinaryOp operator, TBinaryOp assignOperator,
                  TypedExpr left, TypedExpr right) {
        super(location, type);
        this.operator = operator;
        this.assignOperator = assignOperator;
        this.left = left;
        this.right = right;
    }

    public TBinop(TBinaryOp operator, TypedExpr left, TypedExpr right) {
        this(SourceLocation.UNKNOWN, operator.isComparison() ? TypeRef.BOOL : left.getType(),
                operator, null, left, right);
    }

    public TBinaryOp getOperator() {
        return operator;
    }

    /** 复合赋值（ASSIGN_OP）时的内层运算符，其他情况为 null */
    public TBinaryOp getAssignOperator() {
        return assignOperator;
    }

    public TypedExpr getLeft() {
        return left;
    }

    public TypedExpr getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitBinop(this, context);
    }

    /**
     * 二元运算符
     */
    public enum TBinaryOp {
        ADD, SUB, MUL, DIV, MOD,
        EQ, NEQ, LT, LTE, GT, GTE,
        BOOL_AND, BOOL_OR,
        AND, OR, XOR, SHL, SHR, USHR,
        ASSIGN, ASSIGN_OP,
        NULL_COALESCE,
        INTERVAL;

        public boolean isComparison() {
            switch (this) {
                case EQ: case NEQ: case LT: case LTE: case GT: case GTE:
                case BOOL_AND: case BOOL_OR:
                    return true;
                default:
                    return false;
            }
        }

        public boolean isAssignment() {
            return this == ASSIGN || this == ASSIGN_OP;
        }
    }
}
