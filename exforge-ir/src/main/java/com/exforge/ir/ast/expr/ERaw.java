package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 原样注入的目标代码。内容来自结构化 AST 之外，任何重写都不会修改它。
 */
public class ERaw extends ElixirNode {
    private final String code;

    public ERaw(SourceLocation location, String code) {
        super(location);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitRaw(this, context);
    }
}
