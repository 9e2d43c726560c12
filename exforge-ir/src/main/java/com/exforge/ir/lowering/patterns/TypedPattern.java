package com.exforge.ir.lowering.patterns;

import com.exforge.compiler.ast.TypedExpr;
import com.exforge.ir.InternalCompilerError;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.lowering.PatternContext;

import java.util.Optional;

/**
 * 类型化树上的惯用法识别模式。
 * <p>
 * {@link #extract} 是唯一的判定来源：{@link #matches} 定义为提取成功，两者不可能不一致。
 * 提取不抛异常；形状不符返回 {@code Optional.empty()}，不返回部分结果。
 *
 * @param <F> 提取出的字段
 */
public interface TypedPattern<F> {

    /**
     * 模式名称（用于日志和诊断）。
     */
    String getName();

    Optional<F> extract(TypedExpr expr);

    default boolean matches(TypedExpr expr) {
        return extract(expr).isPresent();
    }

    /**
     * 由提取出的字段构建中间节点。
     */
    ElixirNode transform(F fields, PatternContext context);

    /**
     * 识别并变换。只应在 {@link #matches} 为 true 后调用，否则说明判定与提取不同步。
     *
     * @throws InternalCompilerError 子树不匹配时
     */
    default ElixirNode apply(TypedExpr expr, PatternContext context) {
        Optional<F> fields = extract(expr);
        if (!fields.isPresent()) {
            throw new InternalCompilerError(getName(), "pattern applied to a non-matching subtree", expr);
        }
        return transform(fields.get(), context);
    }
}
