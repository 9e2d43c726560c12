package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * return 语句，value 可为 null
 */
public class TReturn extends TypedExpr {
    private final TypedExpr value;

    public TReturn(SourceLocation location, TypedExpr value) {
        super(location, value != null ? value.getType() : TypeRef.VOID);
        this.value = value;
    }

    public TypedExpr getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitReturn(this, context);
    }
}
