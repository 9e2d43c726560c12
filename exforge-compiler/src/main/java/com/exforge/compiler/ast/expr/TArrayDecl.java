package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 数组字面量
 */
public class TArrayDecl extends TypedExpr {
    private final List<TypedExpr> elements;

    public TArrayDecl(SourceLocation location, TypeRef type, List<TypedExpr> elements) {
        super(location, type);
        this.elements = elements;
    }

    public TArrayDecl(List<TypedExpr> elements) {
        this(SourceLocation.UNKNOWN, TypeRef.arrayOf(TypeRef.DYNAMIC), elements);
    }

    public List<TypedExpr> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitArrayDecl(this, context);
    }
}
