package com.exforge.ir.ast.control;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * try do ... rescue ... catch ... else ... after ... end
 */
public class ETry extends ElixirNode {
    private final ElixirNode body;
    private final List<ERescueClause> rescueClauses;
    private final List<ECatchClause> catchClauses;
    private final List<ECaseClause> elseClauses;
    private final ElixirNode after;

    public ETry(SourceLocation location, ElixirNode body, List<ERescueClause> rescueClauses,
                List<ECatchClause> catchClauses, List<ECaseClause> elseClauses, ElixirNode after) {
        super(location);
        this.body = body;
        this.rescueClauses = rescueClauses;
        this.catchClauses = catchClauses;
        this.elseClauses = elseClauses;
        this.after = after;
    }

    public ElixirNode getBody() {
        return body;
    }

    public List<ERescueClause> getRescueClauses() {
        return rescueClauses;
    }

    public List<ECatchClause> getCatchClauses() {
        return catchClauses;
    }

    public List<ECaseClause> getElseClauses() {
        return elseClauses;
    }

    /** after 块，可为 null */
    public ElixirNode getAfter() {
        return after;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitTry(this, context);
    }
}
