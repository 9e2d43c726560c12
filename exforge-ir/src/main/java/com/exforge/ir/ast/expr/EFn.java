package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * 匿名函数 fn clauses end（一个或多个带守卫的子句）
 */
public class EFn extends ElixirNode {
    private final List<EFnClause> clauses;

    public EFn(SourceLocation location, List<EFnClause> clauses) {
        super(location);
        this.clauses = clauses;
    }

    public List<EFnClause> getClauses() {
        return clauses;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitFn(this, context);
    }
}
