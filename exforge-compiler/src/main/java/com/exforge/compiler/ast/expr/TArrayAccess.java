package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * 数组下标访问
 */
public class TArrayAccess extends TypedExpr {
    private final TypedExpr target;
    private final TypedExpr index;

    public TArrayAccess(SourceLocation location, TypeRef type, TypedExpr target, TypedExpr index) {
        super(location, type);
        this.target = target;
        this.index = index;
    }

    public TArrayAccess(TypedExpr target, TypedExpr index) {
        this(SourceLocation.UNKNOWN, TypeRef.DYNAMIC, target, index);
    }

    public TypedExpr getTarget() {
        return target;
    }

    public TypedExpr getIndex() {
        return index;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitArrayAccess(this, context);
    }
}
