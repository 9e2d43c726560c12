package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;
import com.exforge.compiler.ast.TVariable;

/**
 * 局部变量声明（可带初始值）
 */
public class TVar extends TypedExpr {
    private final TVariable variable;
    private final TypedExpr init;

    public TVar(SourceLocation location, TVariable variable, TypedExpr init) {
        super(location, TypeRef.VOID);
        this.variable = variable;
        this.init = init;
    }

    public TVar(TVariable variable, TypedExpr init) {
        this(SourceLocation.UNKNOWN, variable, init);
    }

    public TVariable getVariable() {
        return variable;
    }

    public TypedExpr getInit() {
        return init;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitVar(this, context);
    }
}
