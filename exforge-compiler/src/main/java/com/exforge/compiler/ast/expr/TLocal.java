package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;
import com.exforge.compiler.ast.TVariable;

/**
 * 局部变量引用
 */
public class TLocal extends TypedExpr {
    private final TVariable variable;

    public TLocal(SourceLocation location, TVariable variable) {
        super(location, variable.getType());
        this.variable = variable;
    }

    public TLocal(TVariable variable) {
        this(SourceLocation.UNKNOWN, variable);
    }

    public TVariable getVariable() {
        return variable;
    }

    /** 是否引用给定绑定 */
    public boolean refersTo(TVariable other) {
        return variable.getId() == other.getId();
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitLocal(this, context);
    }
}
