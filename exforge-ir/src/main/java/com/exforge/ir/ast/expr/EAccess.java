package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 下标访问 target[key]
 */
public class EAccess extends ElixirNode {
    private final ElixirNode target;
    private final ElixirNode key;

    public EAccess(SourceLocation location, ElixirNode target, ElixirNode key) {
        super(location);
        this.target = target;
        this.key = key;
    }

    public ElixirNode getTarget() {
        return target;
    }

    public ElixirNode getKey() {
        return key;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitAccess(this, context);
    }
}
