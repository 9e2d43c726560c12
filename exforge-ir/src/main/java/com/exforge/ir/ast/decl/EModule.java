package com.exforge.ir.ast.decl;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * defmodule Name do ... end
 */
public class EModule extends ElixirNode {
    private final String name;
    private final List<ElixirNode> body;

    public EModule(SourceLocation location, String name, List<ElixirNode> body) {
        super(location);
        this.name = name;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    /** 模块体：指令、属性、函数定义 */
    public List<ElixirNode> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitModule(this, context);
    }
}
