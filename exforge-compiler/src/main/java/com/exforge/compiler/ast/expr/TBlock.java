package com.exforge.compiler.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.TypedVisitor;
import com.exforge.compiler.ast.type.TypeRef;

import java.util.Arrays;
import java.util.List;

/**
 * 语句块，值为最后一个表达式
 */
public class TBlock extends TypedExpr {
    private final List<TypedExpr> exprs;

    public TBlock(SourceLocation location, TypeRef type, List<TypedExpr> exprs) {
        super(location, type);
        this.exprs = exprs;
    }

    public static TBlock of(TypedExpr... exprs) {
        List<TypedExpr> list = Arrays.asList(exprs);
        TypeRef type = list.isEmpty() ? TypeRef.VOID : list.get(list.size() - 1).getType();
        return new TBlock(SourceLocation.UNKNOWN, type, list);
    }

    public List<TypedExpr> getExprs() {
        return exprs;
    }

    public int size() {
        return exprs.size();
    }

    public TypedExpr get(int index) {
        return exprs.get(index);
    }

    @Override
    public <R, C> R accept(TypedVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
