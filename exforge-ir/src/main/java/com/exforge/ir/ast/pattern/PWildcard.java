package com.exforge.ir.ast.pattern;

import com.exforge.compiler.ast.SourceLocation;

/**
 * 通配 _ 或 _name
 */
public class PWildcard extends ElixirPattern {
    private final String name;

    public PWildcard(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public PWildcard(SourceLocation location) {
        this(location, null);
    }

    /** 不含前导下划线的名字，匿名通配为 null */
    public String getName() {
        return name;
    }

    public String render() {
        return name == null ? "_" : "_" + name;
    }

    @Override
    public <R, C> R accept(PatternVisitor<R, C> visitor, C context) {
        return visitor.visitWildcard(this, context);
    }
}
