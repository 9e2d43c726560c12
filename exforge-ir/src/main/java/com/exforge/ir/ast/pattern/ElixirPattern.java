package com.exforge.ir.ast.pattern;

import com.exforge.compiler.ast.SourceLocation;

/**
 * 模式（绑定位置）基类。
 * <p>
 * 模式与表达式分开建模：出现在模式里的名字是绑定，不是读取。
 */
public abstract class ElixirPattern {
    protected final SourceLocation location;

    protected ElixirPattern(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(PatternVisitor<R, C> visitor, C context);
}
