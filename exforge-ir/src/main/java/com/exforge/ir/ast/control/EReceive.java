package com.exforge.ir.ast.control;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * receive do clauses after timeout -> body end
 */
public class EReceive extends ElixirNode {
    private final List<ECaseClause> clauses;
    private final ElixirNode afterTimeout;
    private final ElixirNode afterBody;

    public EReceive(SourceLocation location, List<ECaseClause> clauses, ElixirNode afterTimeout, ElixirNode afterBody) {
        super(location);
        this.clauses = clauses;
        this.afterTimeout = afterTimeout;
        this.afterBody = afterBody;
    }

    public List<ECaseClause> getClauses() {
        return clauses;
    }

    /** 超时表达式，无 after 时为 null */
    public ElixirNode getAfterTimeout() {
        return afterTimeout;
    }

    public ElixirNode getAfterBody() {
        return afterBody;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitReceive(this, context);
    }
}
