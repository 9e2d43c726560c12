package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * while / do-while 循环
 */
public class TWhile extends TypedExpr {
    private final TypedExpr condition;
    private final TypedExpr body;
    private final boolean normalWhile;

    public TWhile(SourceLocation location, TypedExpr condition, TypedExpr body, boolean normalWhile) {
        super(location, TypeRef.VOID);
        this.condition = condition;
        this.body = body;
        this.normalWhile = normalWhile;
    }

    public TWhile(TypedExpr condition, TypedExpr body) {
        this(SourceLocation.UNKNOWN, condition, body, true);
    }

    public TypedExpr getCondition() {
        return condition;
    }

    public TypedExpr getBody() {
        return body;
    }

    /** false 表示 do-while */
    public boolean isNormalWhile() {
        return normalWhile;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitWhile(this, context);
    }
}
