package com.exforge.ir.ast.pattern;

import com.exforge.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 二进制模式 <<a::8, rest::binary>>
 */
public class PBinary extends ElixirPattern {
    private final List<PBinarySegment> segments;

    public PBinary(SourceLocation location, List<PBinarySegment> segments) {
        super(location);
        this.segments = segments;
    }

    public List<PBinarySegment> getSegments() {
        return segments;
    }

    @Override
    public <R, C> R accept(PatternVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }
}
