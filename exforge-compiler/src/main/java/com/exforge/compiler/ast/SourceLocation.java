package com.exforge.compiler.ast;

/**
 * 源码位置信息（来自前端的原始位置，用于诊断和溯源）
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    public SourceLocation(String file, int line, int column) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isUnknown() {
        return this == UNKNOWN || line <= 0;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
