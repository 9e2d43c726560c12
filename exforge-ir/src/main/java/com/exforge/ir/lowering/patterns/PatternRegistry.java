package com.exforge.ir.lowering.patterns;

import com.exforge.compiler.ast.TypedExpr;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.lowering.PatternContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * 惯用法模式注册表。按注册顺序尝试，第一个匹配的模式生效。
 */
public class PatternRegistry {

    private static final Logger LOG = Logger.getLogger(PatternRegistry.class.getName());

    private final List<TypedPattern<?>> patterns = new ArrayList<>();

    /**
     * 默认顺序：可空访问器、空值合并、展开循环、迭代器协议。
     */
    public static PatternRegistry createDefault() {
        return new PatternRegistry()
                .register(new InlinedAccessorPattern())
                .register(new NullCoalescePattern())
                .register(new UnrolledCollectionLoopPattern())
                .register(new IteratorProtocolPattern());
    }

    public PatternRegistry register(TypedPattern<?> pattern) {
        patterns.add(pattern);
        return this;
    }

    public List<TypedPattern<?>> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    /**
     * 用第一个匹配的模式变换；没有模式匹配时返回 empty。
     */
    public Optional<ElixirNode> tryApply(TypedExpr expr, PatternContext context) {
        for (TypedPattern<?> pattern : patterns) {
            Optional<ElixirNode> lowered = tryPattern(pattern, expr, context);
            if (lowered.isPresent()) {
                LOG.fine(() -> "pattern " + pattern.getName() + " matched at " + expr.getLocation());
                return lowered;
            }
        }
        return Optional.empty();
    }

    private static <F> Optional<ElixirNode> tryPattern(TypedPattern<F> pattern, TypedExpr expr,
                                                       PatternContext context) {
        Optional<F> fields = pattern.extract(expr);
        if (!fields.isPresent()) return Optional.empty();
        return Optional.of(pattern.transform(fields.get(), context));
    }
}
