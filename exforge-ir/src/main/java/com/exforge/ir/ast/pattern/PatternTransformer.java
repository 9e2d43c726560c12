package com.exforge.ir.ast.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 模式重写组合子（写时复制）。
 * <p>
 * 先重建子模式，再对结果调用 {@link #rewritePattern}。子模式没有变化时返回原对象。
 */
public class PatternTransformer implements PatternVisitor<ElixirPattern, Void> {

    public ElixirPattern transform(ElixirPattern pattern) {
        if (pattern == null) return null;
        return pattern.accept(this, null);
    }

    /** 重写钩子，默认不变 */
    protected ElixirPattern rewritePattern(ElixirPattern pattern) {
        return pattern;
    }

    public static ElixirPattern rewrite(ElixirPattern pattern, UnaryOperator<ElixirPattern> fn) {
        return new PatternTransformer() {
            @Override
            protected ElixirPattern rewritePattern(ElixirPattern p) {
                return fn.apply(p);
            }
        }.transform(pattern);
    }

    protected List<ElixirPattern> transformList(List<ElixirPattern> patterns) {
        List<ElixirPattern> result = null;
        for (int i = 0; i < patterns.size(); i++) {
            ElixirPattern original = patterns.get(i);
            ElixirPattern updated = transform(original);
            if (updated != original && result == null) {
                result = new ArrayList<>(patterns.subList(0, i));
            }
            if (result != null) result.add(updated);
        }
        return result != null ? result : patterns;
    }

    @Override
    public ElixirPattern visitVar(PVar pattern, Void ctx) {
        return rewritePattern(pattern);
    }

    @Override
    public ElixirPattern visitLiteral(PLiteral pattern, Void ctx) {
        return rewritePattern(pattern);
    }

    @Override
    public ElixirPattern visitTuple(PTuple pattern, Void ctx) {
        List<ElixirPattern> elements = transformList(pattern.getElements());
        ElixirPattern result = elements == pattern.getElements() ? pattern
                : new PTuple(pattern.getLocation(), elements);
        return rewritePattern(result);
    }

    @Override
    public ElixirPattern visitList(PList pattern, Void ctx) {
        List<ElixirPattern> elements = transformList(pattern.getElements());
        ElixirPattern result = elements == pattern.getElements() ? pattern
                : new PList(pattern.getLocation(), elements);
        return rewritePattern(result);
    }

    @Override
    public ElixirPattern visitCons(PCons pattern, Void ctx) {
        List<ElixirPattern> heads = transformList(pattern.getHeads());
        ElixirPattern tail = transform(pattern.getTail());
        ElixirPattern result = heads == pattern.getHeads() && tail == pattern.getTail() ? pattern
                : new PCons(pattern.getLocation(), heads, tail);
        return rewritePattern(result);
    }

    @Override
    public ElixirPattern visitMap(PMap pattern, Void ctx) {
        boolean changed = false;
        List<PMapEntry> entries = new ArrayList<>();
        for (PMapEntry entry : pattern.getEntries()) {
            ElixirPattern value = transform(entry.getValue());
            if (value != entry.getValue()) changed = true;
            entries.add(value == entry.getValue() ? entry : new PMapEntry(entry.getKey(), value));
        }
        ElixirPattern result = changed ? new PMap(pattern.getLocation(), entries) : pattern;
        return rewritePattern(result);
    }

    @Override
    public ElixirPattern visitStruct(PStruct pattern, Void ctx) {
        boolean changed = false;
        List<PFieldPattern> fields = new ArrayList<>();
        for (PFieldPattern field : pattern.getFields()) {
            ElixirPattern value = transform(field.getPattern());
            if (value != field.getPattern()) changed = true;
            fields.add(value == field.getPattern() ? field : new PFieldPattern(field.getField(), value));
        }
        ElixirPattern result = changed ? new PStruct(pattern.getLocation(), pattern.getModule(), fields) : pattern;
        return rewritePattern(result);
    }

    @Override
    public ElixirPattern visitPin(PPin pattern, Void ctx) {
        return rewritePattern(pattern);
    }

    @Override
    public ElixirPattern visitWildcard(PWildcard pattern, Void ctx) {
        return rewritePattern(pattern);
    }

    @Override
    public ElixirPattern visitBinary(PBinary pattern, Void ctx) {
        boolean changed = false;
        List<PBinarySegment> segments = new ArrayList<>();
        for (PBinarySegment seg : pattern.getSegments()) {
            ElixirPattern value = transform(seg.getPattern());
            if (value != seg.getPattern()) changed = true;
            segments.add(value == seg.getPattern() ? seg : new PBinarySegment(value, seg.getSize(), seg.getType()));
        }
        ElixirPattern result = changed ? new PBinary(pattern.getLocation(), segments) : pattern;
        return rewritePattern(result);
    }
}
