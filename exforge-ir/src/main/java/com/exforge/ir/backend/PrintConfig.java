package com.exforge.ir.backend;

/**
 * 打印配置
 */
public class PrintConfig {
    private int indentSize = 2;

    public PrintConfig() {
    }

    public PrintConfig(int indentSize) {
        setIndentSize(indentSize);
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indent size must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
