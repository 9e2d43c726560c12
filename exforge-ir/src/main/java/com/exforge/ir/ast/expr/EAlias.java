package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 模块别名 Enum、MyApp.User
 */
public class EAlias extends ElixirNode {
    private final String name;

    public EAlias(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitAlias(this, context);
    }
}
