package com.exforge.ir.ast.control;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * cond do c1 -> b1; ... end
 */
public class ECond extends ElixirNode {
    private final List<ECondClause> clauses;

    public ECond(SourceLocation location, List<ECondClause> clauses) {
        super(location);
        this.clauses = clauses;
    }

    public List<ECondClause> getClauses() {
        return clauses;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitCond(this, context);
    }
}
