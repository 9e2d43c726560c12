package com.exforge.ir.lowering.patterns;

import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.expr.TBinop;
import com.exforge.compiler.ast.expr.TBinop.TBinaryOp;
import com.exforge.compiler.ast.expr.TBlock;
import com.exforge.compiler.ast.expr.TConst;
import com.exforge.compiler.ast.expr.TField;
import com.exforge.compiler.ast.expr.TIf;
import com.exforge.compiler.ast.expr.TLocal;
import com.exforge.compiler.ast.expr.TVar;
import com.exforge.compiler.naming.ElixirNaming;
import com.exforge.ir.InternalCompilerError;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.expr.EBinary;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.lowering.PatternContext;
import com.exforge.ir.lowering.TypedTreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InlinedAccessorPattern 测试")
class InlinedAccessorPatternTest {

    private final InlinedAccessorPattern pattern = new InlinedAccessorPattern();

    private final TVariable user = new TVariable(1, "user");
    private final TVariable tmp = new TVariable(2, "tmp");
    private final TVariable other = new TVariable(3, "other");

    private static PatternContext context() {
        return new PatternContext(new TypedTreeBuilder()::build, new ElixirNaming());
    }

    private static TLocal local(TVariable variable) {
        return new TLocal(variable);
    }

    private static TBinop notNull(TypedExpr expr) {
        return new TBinop(TBinaryOp.NEQ, expr, TConst.ofNull());
    }

    private static TBinop isNull(TypedExpr expr) {
        return new TBinop(TBinaryOp.EQ, expr, TConst.ofNull());
    }

    private String lower(TypedExpr expr) {
        return ElixirPrinter.canonical(pattern.apply(expr, context()));
    }

    // ============ 单临时变量 ============

    @Nested
    @DisplayName("单临时变量")
    class Single {

        @Test
        @DisplayName("!= null 时 then 分支是有值分支")
        void testNotNullTest() {
            TBlock block = TBlock.of(
                    new TVar(tmp, new TField(local(user), "address")),
                    new TIf(notNull(local(tmp)), new TField(local(tmp), "city"), TConst.ofNull()));
            assertThat(lower(block)).isEqualTo(
                    "case user.address do\n  nil -> nil\n  tmp -> tmp.city\nend");
        }

        @Test
        @DisplayName("== null 时 else 分支是有值分支")
        void testIsNullTest() {
            TBlock block = TBlock.of(
                    new TVar(tmp, new TField(local(user), "address")),
                    new TIf(isNull(local(tmp)), TConst.ofString("none"), new TField(local(tmp), "city")));
            assertThat(lower(block)).isEqualTo(
                    "case user.address do\n  nil -> \"none\"\n  tmp -> tmp.city\nend");
        }

        @Test
        @DisplayName("null 写在左侧也能识别")
        void testNullOnLeft() {
            TBlock block = TBlock.of(
                    new TVar(tmp, new TField(local(user), "address")),
                    new TIf(new TBinop(TBinaryOp.NEQ, TConst.ofNull(), local(tmp)),
                            new TField(local(tmp), "city"), null));
            assertThat(lower(block)).isEqualTo(
                    "case user.address do\n  nil -> nil\n  tmp -> tmp.city\nend");
        }

        @Test
        @DisplayName("提取字段")
        void testFields() {
            TField init = new TField(local(user), "address");
            TField present = new TField(local(tmp), "city");
            TBlock block = TBlock.of(new TVar(tmp, init), new TIf(notNull(local(tmp)), present, null));
            InlinedAccessorPattern.Fields fields = pattern.extract(block).get();
            assertThat(fields.isMultiTemp()).isFalse();
            assertThat(fields.getTemp().getId()).isEqualTo(2);
            assertThat(fields.getInit()).isSameAs(init);
            assertThat(fields.getPresentBranch()).isSameAs(present);
            assertThat(fields.getAbsentBranch()).isNull();
            assertThat(fields.getTempCount()).isEqualTo(1);
        }
    }

    // ============ 多临时变量 ============

    @Nested
    @DisplayName("多临时变量")
    class MultiTemp {

        private TBlock twoTemps(TVariable secondGuard) {
            return TBlock.of(
                    new TVar(tmp, new TField(local(user), "a")),
                    new TVar(other, new TField(local(user), "b")),
                    new TBinop(TBinaryOp.ADD,
                            new TIf(notNull(local(tmp)), local(tmp), TConst.ofInt(0)),
                            new TIf(notNull(local(secondGuard)), local(secondGuard), TConst.ofInt(0))));
        }

        @Test
        @DisplayName("两个不同临时变量的判空分支组合")
        void testExtract() {
            Optional<InlinedAccessorPattern.Fields> fields = pattern.extract(twoTemps(other));
            assertThat(fields).isPresent();
            assertThat(fields.get().isMultiTemp()).isTrue();
            assertThat(fields.get().getTempCount()).isEqualTo(2);
            assertThat(fields.get().getResult()).isInstanceOf(TBinop.class);
        }

        @Test
        @DisplayName("只输出最后的组合表达式")
        void testTransformEmitsResult() {
            ElixirNode lowered = pattern.apply(twoTemps(other), context());
            assertThat(lowered).isInstanceOf(EBinary.class);
        }

        @Test
        @DisplayName("两侧测试同一个临时变量时不匹配")
        void testSameTempDeclines() {
            assertThat(pattern.matches(twoTemps(tmp))).isFalse();
        }
    }

    // ============ 不匹配 ============

    @Nested
    @DisplayName("不匹配")
    class Declines {

        @Test
        @DisplayName("测试的不是临时变量")
        void testOtherVariable() {
            TBlock block = TBlock.of(
                    new TVar(tmp, new TField(local(user), "address")),
                    new TIf(notNull(local(other)), local(other), null));
            assertThat(pattern.extract(block)).isEmpty();
        }

        @Test
        @DisplayName("== null 且没有 else 分支")
        void testMissingPresentBranch() {
            TBlock block = TBlock.of(
                    new TVar(tmp, new TField(local(user), "address")),
                    new TIf(isNull(local(tmp)), TConst.ofNull(), null));
            assertThat(pattern.extract(block)).isEmpty();
        }

        @Test
        @DisplayName("非块表达式")
        void testNotBlock() {
            assertThat(pattern.matches(local(user))).isFalse();
        }

        @Test
        @DisplayName("matches 与 extract 一致")
        void testMatchesAgreesWithExtract() {
            TBlock block = TBlock.of(new TVar(tmp, TConst.ofInt(1)), local(tmp));
            assertThat(pattern.matches(block)).isEqualTo(pattern.extract(block).isPresent()).isFalse();
        }

        @Test
        @DisplayName("对不匹配的子树调用 apply 抛出内部错误")
        void testApplyOnNonMatch() {
            assertThatThrownBy(() -> pattern.apply(local(user), context()))
                    .isInstanceOf(InternalCompilerError.class)
                    .hasMessageContaining(InlinedAccessorPattern.NAME);
        }
    }
}
