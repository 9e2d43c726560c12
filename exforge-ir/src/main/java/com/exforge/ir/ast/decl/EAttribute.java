package com.exforge.ir.ast.decl;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 模块属性 @name value
 */
public class EAttribute extends ElixirNode {
    private final String name;
    private final ElixirNode value;

    public EAttribute(SourceLocation location, String name, ElixirNode value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public ElixirNode getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitAttribute(this, context);
    }
}
