package com.exforge.ir.ast.pattern;

import com.exforge.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 结构体模式 %Module{field: pattern}
 */
public class PStruct extends ElixirPattern {
    private final String module;
    private final List<PFieldPattern> fields;

    public PStruct(SourceLocation location, String module, List<PFieldPattern> fields) {
        super(location);
        this.module = module;
        this.fields = fields;
    }

    public String getModule() {
        return module;
    }

    public List<PFieldPattern> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(PatternVisitor<R, C> visitor, C context) {
        return visitor.visitStruct(this, context);
    }
}
