package com.exforge.ir.lowering.patterns;

import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.expr.TBinop;
import com.exforge.compiler.ast.expr.TBinop.TBinaryOp;
import com.exforge.compiler.ast.expr.TBlock;
import com.exforge.compiler.ast.expr.TConst;
import com.exforge.compiler.ast.expr.TLocal;
import com.exforge.compiler.ast.expr.TVar;
import com.exforge.compiler.naming.ElixirNaming;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.lowering.PatternContext;
import com.exforge.ir.lowering.TypedTreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PatternRegistry 测试")
class PatternRegistryTest {

    private static PatternContext context() {
        return new PatternContext(new TypedTreeBuilder()::build, new ElixirNaming());
    }

    @Test
    @DisplayName("默认注册顺序")
    void testDefaultOrder() {
        List<String> names = new ArrayList<>();
        for (TypedPattern<?> pattern : PatternRegistry.createDefault().getPatterns()) names.add(pattern.getName());
        assertThat(names).containsExactly(InlinedAccessorPattern.NAME, NullCoalescePattern.NAME,
                UnrolledCollectionLoopPattern.NAME, IteratorProtocolPattern.NAME);
    }

    @Test
    @DisplayName("模式列表不可修改")
    void testPatternsUnmodifiable() {
        List<TypedPattern<?>> patterns = PatternRegistry.createDefault().getPatterns();
        assertThatThrownBy(() -> patterns.add(new NullCoalescePattern()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("没有模式匹配时返回 empty")
    void testNoMatch() {
        Optional<ElixirNode> lowered = PatternRegistry.createDefault().tryApply(TConst.ofInt(1), context());
        assertThat(lowered).isEmpty();
    }

    @Test
    @DisplayName("第一个匹配的模式生效")
    void testFirstMatchWins() {
        TVariable tmp = new TVariable(1, "tmp");
        TBlock block = TBlock.of(new TVar(tmp, TConst.ofNull()),
                new TBinop(TBinaryOp.NULL_COALESCE, new TLocal(tmp), TConst.ofInt(0)));
        Optional<ElixirNode> lowered = PatternRegistry.createDefault().tryApply(block, context());
        assertThat(lowered).isPresent();
        assertThat(ElixirPrinter.canonical(lowered.get())).isEqualTo("case nil do\n  nil -> 0\n  tmp -> tmp\nend");
    }

    @Test
    @DisplayName("空注册表不匹配任何子树")
    void testEmptyRegistry() {
        assertThat(new PatternRegistry().tryApply(TConst.ofInt(1), context())).isEmpty();
    }
}
