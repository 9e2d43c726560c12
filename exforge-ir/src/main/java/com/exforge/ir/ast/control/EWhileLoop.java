package com.exforge.ir.ast.control;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

/**
 * 合成的 while 循环占位。打印器把它展开为自引用匿名函数不动点，
 * 每次出现使用新的唯一函数名。
 */
public class EWhileLoop extends ElixirNode {
    private final ElixirNode condition;
    private final ElixirNode body;

    public EWhileLoop(SourceLocation location, ElixirNode condition, ElixirNode body) {
        super(location);
        this.condition = condition;
        this.body = body;
    }

    public ElixirNode getCondition() {
        return condition;
    }

    public ElixirNode getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitWhileLoop(this, context);
    }
}
