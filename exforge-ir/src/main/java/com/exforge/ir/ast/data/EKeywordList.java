package com.exforge.ir.ast.data;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * 关键字列表 [a: 1, b: 2]
 */
public class EKeywordList extends ElixirNode {
    private final List<EKeywordPair> pairs;

    public EKeywordList(SourceLocation location, List<EKeywordPair> pairs) {
        super(location);
        this.pairs = pairs;
    }

    public List<EKeywordPair> getPairs() {
        return pairs;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitKeywordList(this, context);
    }
}
