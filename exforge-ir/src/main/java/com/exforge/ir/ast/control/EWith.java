package com.exforge.ir.ast.control;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * with p1 <- e1, p2 <- e2 do body else clauses end
 */
public class EWith extends ElixirNode {
    private final List<EWithClause> clauses;
    private final ElixirNode body;
    private final List<ECaseClause> elseClauses;

    public EWith(SourceLocation location, List<EWithClause> clauses, ElixirNode body, List<ECaseClause> elseClauses) {
        super(location);
        this.clauses = clauses;
        this.body = body;
        this.elseClauses = elseClauses;
    }

    public List<EWithClause> getClauses() {
        return clauses;
    }

    public ElixirNode getBody() {
        return body;
    }

    public List<ECaseClause> getElseClauses() {
        return elseClauses;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitWith(this, context);
    }
}
