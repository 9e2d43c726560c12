package com.exforge.ir.ast.pattern;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;

/**
 * 字面量模式。value 为字面量、原子或 nil 节点。
 */
public class PLiteral extends ElixirPattern {
    private final ElixirNode value;

    public PLiteral(SourceLocation location, ElixirNode value) {
        super(location);
        this.value = value;
    }

    public ElixirNode getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(PatternVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
