package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;
import com.exforge.ir.ast.pattern.ElixirPattern;

/**
 * 模式匹配/绑定 pattern = value
 */
public class EMatch extends ElixirNode {
    private final ElixirPattern pattern;
    private final ElixirNode value;

    public EMatch(SourceLocation location, ElixirPattern pattern, ElixirNode value) {
        super(location);
        this.pattern = pattern;
        this.value = value;
    }

    public ElixirPattern getPattern() {
        return pattern;
    }

    public ElixirNode getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitMatch(this, context);
    }
}
