package com.exforge.ir;

/**
 * 编译器内部一致性错误。
 * <p>
 * 只用于"不应发生"的情况：谓词通过但提取失败、打印器遇到无法渲染的形状等。
 * 普通的"不匹配"用 Optional.empty() 或原样返回节点表示，绝不用本异常。
 */
public class InternalCompilerError extends RuntimeException {
    private final String stage;
    private final String subtree;

    public InternalCompilerError(String stage, String message, Object subtree) {
        super(message);
        this.stage = stage;
        this.subtree = subtree != null ? String.valueOf(subtree) : null;
    }

    /** 出错的 pass / 模式 / 打印器名称 */
    public String getStage() {
        return stage;
    }

    public String getSubtree() {
        return subtree;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(stage).append("] ").append(super.getMessage());
        if (subtree != null) {
            sb.append(" (subtree: ").append(subtree).append(')');
        }
        return sb.toString();
    }
}
