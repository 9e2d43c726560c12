package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * 枚举构造器参数提取（index 从 0 开始）。arity 是构造器的参数个数，前端未提供时为 -1。
 */
public class TEnumParameter extends TypedExpr {
    private final TypedExpr target;
    private final String constructor;
    private final int index;
    private final int arity;

    public TEnumParameter(SourceLocation location, TypeRef type, TypedExpr target, String constructor,
                          int index, int arity) {
        super(location, type);
        this.target = target;
        this.constructor = constructor;
        this.index = index;
        this.arity = arity;
    }

    public TEnumParameter(SourceLocation location, TypeRef type, TypedExpr target, String constructor, int index) {
        this(location, type, target, constructor, index, -1);
    }

    public TEnumParameter(TypedExpr target, String constructor, int index) {
        this(SourceLocation.UNKNOWN, TypeRef.DYNAMIC, target, constructor, index);
    }

    public TypedExpr getTarget() {
        return target;
    }

    public String getConstructor() {
        return constructor;
    }

    public int getIndex() {
        return index;
    }

    public int getArity() {
        return arity;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitEnumParameter(this, context);
    }
}
