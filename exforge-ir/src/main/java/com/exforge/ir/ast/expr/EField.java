package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 字段访问 target.field
 */
public class EField extends ElixirNode {
    private final ElixirNode target;
    private final String field;

    public EField(SourceLocation location, ElixirNode target, String field) {
        super(location);
        this.target = target;
        this.field = field;
    }

    public ElixirNode getTarget() {
        return target;
    }

    public String getField() {
        return field;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitField(this, context);
    }
}
