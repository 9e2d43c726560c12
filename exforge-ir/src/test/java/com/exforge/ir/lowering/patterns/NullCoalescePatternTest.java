package com.exforge.ir.lowering.patterns;

import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.expr.TBinop;
import com.exforge.compiler.ast.expr.TBinop.TBinaryOp;
import com.exforge.compiler.ast.expr.TBlock;
import com.exforge.compiler.ast.expr.TCall;
import com.exforge.compiler.ast.expr.TConst;
import com.exforge.compiler.ast.expr.TLocal;
import com.exforge.compiler.ast.expr.TVar;
import com.exforge.compiler.naming.ElixirNaming;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.lowering.PatternContext;
import com.exforge.ir.lowering.TypedTreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("NullCoalescePattern 测试")
class NullCoalescePatternTest {

    private final NullCoalescePattern pattern = new NullCoalescePattern();

    private final TVariable cache = new TVariable(1, "cache");
    private final TVariable tmp = new TVariable(2, "tmp");

    private static PatternContext context() {
        return new PatternContext(new TypedTreeBuilder()::build, new ElixirNaming());
    }

    private TypedExpr lookup() {
        return TCall.method(new TLocal(cache), "lookup", TConst.ofString("k"));
    }

    private TBlock coalesce(TypedExpr left) {
        return TBlock.of(new TVar(tmp, lookup()), new TBinop(TBinaryOp.NULL_COALESCE, left, TConst.ofInt(0)));
    }

    @Test
    @DisplayName("临时变量 ?? 默认值改写为 case")
    void testLowering() {
        String printed = ElixirPrinter.canonical(pattern.apply(coalesce(new TLocal(tmp)), context()));
        assertThat(printed).isEqualTo("case cache.lookup(\"k\") do\n  nil -> 0\n  tmp -> tmp\nend");
    }

    @Test
    @DisplayName("提取字段")
    void testFields() {
        NullCoalescePattern.Fields fields = pattern.extract(coalesce(new TLocal(tmp))).get();
        assertThat(fields.getTemp().getName()).isEqualTo("tmp");
        assertThat(fields.getValue()).isInstanceOf(TCall.class);
        assertThat(fields.getFallback()).isInstanceOf(TConst.class);
    }

    @Test
    @DisplayName("左侧不是临时变量时不匹配")
    void testOtherLeftOperand() {
        assertThat(pattern.matches(coalesce(new TLocal(cache)))).isFalse();
    }

    @Test
    @DisplayName("临时变量没有初值时不匹配")
    void testNoInit() {
        TBlock block = TBlock.of(new TVar(tmp, null),
                new TBinop(TBinaryOp.NULL_COALESCE, new TLocal(tmp), TConst.ofInt(0)));
        assertThat(pattern.extract(block)).isEmpty();
    }

    @Test
    @DisplayName("块长度不是 2 时不匹配")
    void testWrongSize() {
        TBlock block = TBlock.of(new TVar(tmp, lookup()), new TLocal(cache),
                new TBinop(TBinaryOp.NULL_COALESCE, new TLocal(tmp), TConst.ofInt(0)));
        assertThat(pattern.extract(block)).isEmpty();
    }
}
