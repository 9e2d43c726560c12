package com.exforge.ir.ast;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.expr.EBinary;
import com.exforge.ir.ast.expr.ELiteral;
import com.exforge.ir.ast.expr.EVar;
import com.exforge.ir.ast.pattern.PTuple;
import com.exforge.ir.ast.pattern.PVar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.exforge.ir.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("StructuralEquality 测试")
class StructuralEqualityTest {

    private static final SourceLocation ELSEWHERE = new SourceLocation("other.hx", 12, 4);

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class Expressions {

        @Test
        @DisplayName("忽略位置、源绑定 id 和元数据")
        void testIgnoresLocationAndMetadata() {
            ElixirNode a = binary(BinaryOp.ADD, var("i"), integer(1));
            EBinary b = new EBinary(ELSEWHERE, BinaryOp.ADD, new EVar(ELSEWHERE, "i", 7),
                    new ELiteral(ELSEWHERE, ELiteral.LiteralKind.INTEGER, 1L));
            b.withMetadata(Metadata.of(Metadata.KEEP_INLINE, true));
            assertThat(StructuralEquality.equal(a, b)).isTrue();
        }

        @Test
        @DisplayName("运算符不同则不等")
        void testOperatorDiffers() {
            assertThat(StructuralEquality.equal(
                    binary(BinaryOp.ADD, var("i"), integer(1)),
                    binary(BinaryOp.SUB, var("i"), integer(1)))).isFalse();
        }

        @Test
        @DisplayName("整数字面量按数值比较")
        void testIntegerByValue() {
            ElixirNode boxedInt = new ELiteral(ELSEWHERE, ELiteral.LiteralKind.INTEGER, 3);
            assertThat(StructuralEquality.equal(integer(3), boxedInt)).isTrue();
            assertThat(StructuralEquality.equal(integer(3), integer(4))).isFalse();
        }

        @Test
        @DisplayName("字符串与整数不等")
        void testLiteralKindDiffers() {
            assertThat(StructuralEquality.equal(integer(1), string("1"))).isFalse();
        }

        @Test
        @DisplayName("列表长度不同则不等")
        void testListSizeDiffers() {
            assertThat(StructuralEquality.equal(listOf(integer(1), integer(2)), listOf(integer(1)))).isFalse();
            assertThat(StructuralEquality.equal(listOf(integer(1), integer(2)),
                    listOf(integer(1), integer(2)))).isTrue();
        }

        @Test
        @DisplayName("嵌套调用逐层比较")
        void testNestedCalls() {
            ElixirNode a = remote("Enum", "at", var("xs"), call("idx", var("i")));
            ElixirNode b = remote("Enum", "at", var("xs"), call("idx", var("j")));
            assertThat(StructuralEquality.equal(a, a)).isTrue();
            assertThat(StructuralEquality.equal(a, b)).isFalse();
        }

        @Test
        @DisplayName("节点变体不同则不等")
        void testVariantDiffers() {
            assertThat(StructuralEquality.equal(tuple(integer(1)), listOf(integer(1)))).isFalse();
        }

        @Test
        @DisplayName("null 只与 null 相等")
        void testNull() {
            assertThat(StructuralEquality.equal((ElixirNode) null, (ElixirNode) null)).isTrue();
            assertThat(StructuralEquality.equal(nil(), null)).isFalse();
        }
    }

    // ============ 模式 ============

    @Nested
    @DisplayName("模式")
    class Patterns {

        @Test
        @DisplayName("绑定名相同的元组模式相等")
        void testTuplePattern() {
            PTuple other = new PTuple(ELSEWHERE, Arrays.asList(new PVar(ELSEWHERE, "a", 3), wildcard()));
            assertThat(StructuralEquality.equal(ptuple(pvar("a"), wildcard()), other)).isTrue();
        }

        @Test
        @DisplayName("绑定名不同则不等")
        void testNameDiffers() {
            assertThat(StructuralEquality.equal(ptuple(pvar("a")), ptuple(pvar("b")))).isFalse();
        }

        @Test
        @DisplayName("匹配表达式同时比较模式和值")
        void testMatch() {
            assertThat(StructuralEquality.equal(bind("x", integer(1)), bind("x", integer(1)))).isTrue();
            assertThat(StructuralEquality.equal(bind("x", integer(1)), bind("y", integer(1)))).isFalse();
        }
    }
}
