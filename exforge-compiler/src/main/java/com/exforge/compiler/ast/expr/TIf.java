package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * 条件表达式，elseExpr 可为 null
 */
public class TIf extends TypedExpr {
    private final TypedExpr condition;
    private final TypedExpr thenExpr;
    private final TypedExpr elseExpr;

    public TIf(SourceLocation location, TypeRef type, TypedExpr condition, TypedExpr thenExpr, TypedExpr elseExpr) {
        super(location, type);
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    public TIf(TypedExpr condition, TypedExpr thenExpr, TypedExpr elseExpr) {
        this(SourceLocation.UNKNOWN, thenExpr.getType(), condition, thenExpr, elseExpr);
    }

    public TypedExpr getCondition() {
        return condition;
    }

    public TypedExpr getThenExpr() {
        return thenExpr;
    }

    public TypedExpr getElseExpr() {
        return elseExpr;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
