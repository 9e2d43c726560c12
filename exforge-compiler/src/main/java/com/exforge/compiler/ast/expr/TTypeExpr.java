package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

/**
 * 类型/模块引用（静态调用的目标）
 */
public class TTypeExpr extends TypedExpr {
    private final String path;

    public TTypeExpr(SourceLocation location, String path) {
        super(location, new TypeRef(path));
        this.path = path;
    }

    public TTypeExpr(String path) {
        this(SourceLocation.UNKNOWN, path);
    }

    public String getPath() {
        return path;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitTypeExpr(this, context);
    }
}
