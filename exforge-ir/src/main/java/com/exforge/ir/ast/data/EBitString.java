package com.exforge.ir.ast.data;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.ElixirVisitor;

import java.util.List;

/**
 * 位串 <<a::8, rest::binary>>
 */
public class EBitString extends ElixirNode {
    private final List<EBitSegment> segments;

    public EBitString(SourceLocation location, List<EBitSegment> segments) {
        super(location);
        this.segments = segments;
    }

    public List<EBitSegment> getSegments() {
        return segments;
    }

    @Override
    public <R, C> R accept(ElixirVisitor<R, C> visitor, C context) {
        return visitor.visitBitString(this, context);
    }
}
