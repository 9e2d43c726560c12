package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * 元数据包装（例如 @:unrolled 标记展开后的循环）
 */
public class TMeta extends TypedExpr {
    public static final String UNROLLED = ":unrolled";

    private final String name;
    private final TypedExpr expr;

    public TMeta(SourceLocation location, String name, TypedExpr expr) {
        super(location, expr.getType());
        this.name = name;
        this.expr = expr;
    }

    public TMeta(String name, TypedExpr expr) {
        this(SourceLocation.UNKNOWN, name, expr);
    }

    public String getName() {
        return name;
    }

    public TypedExpr getExpr() {
        return expr;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitMeta(this, context);
    }
}
