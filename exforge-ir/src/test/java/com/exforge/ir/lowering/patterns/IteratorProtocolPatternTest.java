package com.exforge.ir.lowering.patterns;

import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.expr.TBlock;
import com.exforge.compiler.ast.expr.TCall;
import com.exforge.compiler.ast.expr.TField;
import com.exforge.compiler.ast.expr.TLocal;
import com.exforge.compiler.ast.expr.TTypeExpr;
import com.exforge.compiler.ast.expr.TVar;
import com.exforge.compiler.ast.expr.TWhile;
import com.exforge.compiler.ast.type.TypeRef;
import com.exforge.compiler.naming.ElixirNaming;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.lowering.PatternContext;
import com.exforge.ir.lowering.TypedTreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("IteratorProtocolPattern 测试")
class IteratorProtocolPatternTest {

    private final IteratorProtocolPattern pattern = new IteratorProtocolPattern();

    private final TVariable it = new TVariable(1, "it");
    private final TVariable entry = new TVariable(2, "entry");
    private final TVariable key = new TVariable(3, "key");
    private final TVariable value = new TVariable(4, "value");
    private final TVariable scores = new TVariable(5, "scores", new TypeRef("Map"));
    private final TVariable names = new TVariable(6, "names", TypeRef.arrayOf(TypeRef.STRING));

    private static PatternContext context() {
        return new PatternContext(new TypedTreeBuilder()::build, new ElixirNaming());
    }

    private static TLocal local(TVariable variable) {
        return new TLocal(variable);
    }

    private static TypedExpr println(TypedExpr arg) {
        return TCall.method(new TTypeExpr("Sys"), "println", arg);
    }

    private TBlock iterate(TVariable collection, String method, TVariable current, TypedExpr... rest) {
        TypedExpr[] body = new TypedExpr[rest.length + 1];
        body[0] = new TVar(current, TCall.method(local(it), "next"));
        System.arraycopy(rest, 0, body, 1, rest.length);
        return TBlock.of(
                new TVar(it, TCall.method(local(collection), method)),
                new TWhile(TCall.method(local(it), "hasNext"), TBlock.of(body)));
    }

    private String lower(TypedExpr expr) {
        return ElixirPrinter.canonical(pattern.apply(expr, context()));
    }

    // ============ 识别 ============

    @Nested
    @DisplayName("识别")
    class Recognizes {

        @Test
        @DisplayName("keyValueIterator 解构为键值元组")
        void testKeyValue() {
            TBlock block = iterate(scores, "keyValueIterator", entry,
                    new TVar(key, new TField(local(entry), "key")),
                    new TVar(value, new TField(local(entry), "value")),
                    println(local(value)));
            assertThat(pattern.extract(block).get().getKind()).isEqualTo(IteratorProtocolPattern.Kind.KEY_VALUE);
            assertThat(lower(block)).isEqualTo("for {key, value} <- scores, do: Sys.println(value)");
        }

        @Test
        @DisplayName("只投影键时值位置为通配符")
        void testKeyOnly() {
            TBlock block = iterate(scores, "keyValueIterator", entry,
                    new TVar(key, new TField(local(entry), "key")),
                    println(local(key)));
            assertThat(lower(block)).isEqualTo("for {key, _} <- scores, do: Sys.println(key)");
        }

        @Test
        @DisplayName("keys 遍历 Map.keys")
        void testKeys() {
            TBlock block = iterate(scores, "keys", key, println(local(key)));
            assertThat(pattern.extract(block).get().getKind()).isEqualTo(IteratorProtocolPattern.Kind.KEYS);
            assertThat(lower(block)).isEqualTo("for key <- Map.keys(scores), do: Sys.println(key)");
        }

        @Test
        @DisplayName("Map 上的 iterator 遍历 Map.values")
        void testMapValues() {
            TBlock block = iterate(scores, "iterator", value, println(local(value)));
            assertThat(lower(block)).isEqualTo("for value <- Map.values(scores), do: Sys.println(value)");
        }

        @Test
        @DisplayName("数组上的 iterator 直接遍历列表")
        void testArrayValues() {
            TBlock block = iterate(names, "iterator", value, println(local(value)));
            assertThat(pattern.extract(block).get().getKind()).isEqualTo(IteratorProtocolPattern.Kind.VALUES);
            assertThat(lower(block)).isEqualTo("for value <- names, do: Sys.println(value)");
        }

        @Test
        @DisplayName("空循环体输出 nil")
        void testEmptyBody() {
            assertThat(lower(iterate(names, "iterator", value))).isEqualTo("for value <- names, do: nil");
        }
    }

    // ============ 不匹配 ============

    @Nested
    @DisplayName("不匹配")
    class Declines {

        @Test
        @DisplayName("循环体再次使用迭代器")
        void testBodyUsesIterator() {
            TBlock block = iterate(names, "iterator", value, TCall.method(local(it), "next"));
            assertThat(pattern.extract(block)).isEmpty();
        }

        @Test
        @DisplayName("键值遍历的循环体使用整个条目")
        void testBodyUsesEntry() {
            TBlock block = iterate(scores, "keyValueIterator", entry,
                    new TVar(key, new TField(local(entry), "key")),
                    println(local(entry)));
            assertThat(pattern.extract(block)).isEmpty();
        }

        @Test
        @DisplayName("未知的迭代方法")
        void testUnknownSource() {
            assertThat(pattern.matches(iterate(names, "reversed", value))).isFalse();
        }

        @Test
        @DisplayName("循环条件不是 hasNext")
        void testWrongCondition() {
            TBlock block = TBlock.of(
                    new TVar(it, TCall.method(local(names), "iterator")),
                    new TWhile(TCall.method(local(it), "isEmpty"),
                            TBlock.of(new TVar(value, TCall.method(local(it), "next")))));
            assertThat(pattern.matches(block)).isFalse();
        }
    }
}
