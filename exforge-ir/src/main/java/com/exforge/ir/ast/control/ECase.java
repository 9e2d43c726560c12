package com.exforge.ir.ast.control;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * case subject do clauses end
 */
public class ECase extends ElixirNode {
    private final ElixirNode subject;
    private final List<ECaseClause> clauses;

    public ECase(SourceLocation location, ElixirNode subject, List<ECaseClause> clauses) {
        super(location);
        this.subject = subject;
        this.clauses = clauses;
    }

    public ElixirNode getSubject() {
        return subject;
    }

    public List<ECaseClause> getClauses() {
        return clauses;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitCase(this, context);
    }
}
