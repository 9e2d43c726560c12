package com.exforge.ir.ast.expr;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * 语句序列，值为最后一条语句
 */
public class EBlock extends ElixirNode {
    private final List<ElixirNode> statements;

    public EBlock(SourceLocation location, List<ElixirNode> statements) {
        super(location);
        this.statements = statements;
    }

    public List<ElixirNode> getStatements() {
        return statements;
    }

    public int size() {
        return statements.size();
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    /** 最后一条语句，空块返回 null */
    public ElixirNode last() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
