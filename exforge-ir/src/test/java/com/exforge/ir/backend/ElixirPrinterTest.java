package com.exforge.ir.backend;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.InternalCompilerError;
import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.UnaryOp;
import com.exforge.ir.ast.control.ECase;
import com.exforge.ir.ast.control.ECaseClause;
import com.exforge.ir.ast.control.EIf;
import com.exforge.ir.ast.control.EWhileLoop;
import com.exforge.ir.ast.data.EMap;
import com.exforge.ir.ast.data.EMapEntry;
import com.exforge.ir.ast.decl.EDef;
import com.exforge.ir.ast.decl.EModule;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.ast.pattern.ElixirPattern;
import com.exforge.ir.ast.pattern.PLiteral;
import com.exforge.ir.pass.FreshNameGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.exforge.ir.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("ElixirPrinter 测试")
class ElixirPrinterTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    private static String print(ElixirNode node) {
        return new ElixirPrinter().print(node);
    }

    private static EDef def(EDef.DefKind kind, String name, List<ElixirPattern> params, ElixirNode body) {
        return new EDef(LOC, kind, name, params, null, body);
    }

    private static EIf ifElse(ElixirNode cond, ElixirNode then, ElixirNode els) {
        return new EIf(LOC, cond, then, els);
    }

    // ============ 控制结构 ============

    @Nested
    @DisplayName("if")
    class IfForms {

        @Test
        @DisplayName("简单分支使用单行形式")
        void testInlineIf() {
            ElixirNode node = ifElse(binary(BinaryOp.GT, var("x"), integer(0)), atom("pos"), atom("neg"));
            assertThat(print(node)).isEqualTo("if x > 0, do: :pos, else: :neg");
        }

        @Test
        @DisplayName("多语句分支使用 do/end 块")
        void testBlockIf() {
            ElixirNode node = ifElse(var("c"), block(bind("a", integer(1)), var("a")), null);
            assertThat(print(node)).isEqualTo("if c do\n  a = 1\n  a\nend");
        }

        @Test
        @DisplayName("缩进宽度取自配置")
        void testIndentFromConfig() {
            ElixirNode node = ifElse(var("c"), block(bind("a", integer(1)), var("a")), null);
            String text = new ElixirPrinter(new PrintConfig(4)).print(node);
            assertThat(text).isEqualTo("if c do\n    a = 1\n    a\nend");
        }

        @Test
        @DisplayName("参数位置的控制结构加括号")
        void testControlInArgumentIsParenthesized() {
            ElixirNode node = listOf(ifElse(var("c"), integer(1), integer(2)));
            assertThat(print(node)).isEqualTo("[(if c, do: 1, else: 2)]");
        }
    }

    @Nested
    @DisplayName("case")
    class CaseForms {

        @Test
        @DisplayName("每个子句一行")
        void testCaseClauses() {
            ElixirNode node = new ECase(LOC, var("x"), Arrays.asList(
                    new ECaseClause(new PLiteral(LOC, nil()), atom("none")),
                    new ECaseClause(pvar("v"), var("v"))));
            assertThat(print(node)).isEqualTo("case x do\n  nil -> :none\n  v -> v\nend");
        }

        @Test
        @DisplayName("子句列表为空时报内部错误")
        void testEmptyCaseFails() {
            ElixirNode node = new ECase(LOC, var("x"), Collections.<ECaseClause>emptyList());
            assertThatThrownBy(() -> print(node))
                    .isInstanceOf(InternalCompilerError.class)
                    .hasMessageContaining("printer");
        }
    }

    @Test
    @DisplayName("循环占位打印为自引用匿名函数")
    void testWhileLoop() {
        ElixirNode loop = new EWhileLoop(LOC, binary(BinaryOp.LT, var("x"), integer(10)),
                bind("x", binary(BinaryOp.ADD, var("x"), integer(1))));
        String text = new ElixirPrinter(new PrintConfig(), new FreshNameGenerator()).print(loop);
        assertThat(text).isEqualTo("(fn ->\n"
                + "  while_loop_0 = fn while_loop_0 ->\n"
                + "    if x < 10 do\n"
                + "      x = x + 1\n"
                + "      while_loop_0.(while_loop_0)\n"
                + "    else\n"
                + "      :ok\n"
                + "    end\n"
                + "  end\n"
                + "  while_loop_0.(while_loop_0)\n"
                + "end).()");
    }

    // ============ 模块与定义 ============

    @Nested
    @DisplayName("模块")
    class Modules {

        @Test
        @DisplayName("简单函数体使用 do: 形式")
        void testInlineDef() {
            ElixirNode node = def(EDef.DefKind.DEF, "add", Arrays.<ElixirPattern>asList(pvar("a"), pvar("b")),
                    binary(BinaryOp.ADD, var("a"), var("b")));
            assertThat(print(node)).isEqualTo("def add(a, b), do: a + b");
        }

        @Test
        @DisplayName("定义之间空一行")
        void testBlankLineBetweenDefs() {
            ElixirNode node = new EModule(LOC, "Foo", Arrays.<ElixirNode>asList(
                    def(EDef.DefKind.DEF, "a", Collections.<ElixirPattern>emptyList(), integer(1)),
                    def(EDef.DefKind.DEFP, "b", Collections.<ElixirPattern>emptyList(), integer(2))));
            assertThat(print(node)).isEqualTo("defmodule Foo do\n  def a(), do: 1\n\n  defp b(), do: 2\nend");
        }

        @Test
        @DisplayName("defstruct 不带括号")
        void testBareMacro() {
            assertThat(print(call("defstruct", listOf(atom("a"), atom("b"))))).isEqualTo("defstruct [:a, :b]");
        }
    }

    // ============ 运算 ============

    @Nested
    @DisplayName("运算符")
    class Operators {

        @Test
        @DisplayName("减法子表达式总是加括号")
        void testSubtractionParenthesized() {
            assertThat(print(binary(BinaryOp.SUB, var("a"), binary(BinaryOp.SUB, var("b"), var("c")))))
                    .isEqualTo("a - (b - c)");
            assertThat(print(binary(BinaryOp.ADD, binary(BinaryOp.SUB, var("a"), var("b")), var("c"))))
                    .isEqualTo("(a - b) + c");
        }

        @Test
        @DisplayName("低优先级子表达式加括号")
        void testPrecedence() {
            assertThat(print(binary(BinaryOp.MUL, binary(BinaryOp.ADD, var("a"), var("b")), var("c"))))
                    .isEqualTo("(a + b) * c");
            assertThat(print(binary(BinaryOp.ADD, binary(BinaryOp.MUL, var("a"), var("b")), var("c"))))
                    .isEqualTo("a * b + c");
        }

        @Test
        @DisplayName("取余与位运算打印为函数调用")
        void testFunctionForms() {
            assertThat(print(binary(BinaryOp.REM, var("a"), integer(2)))).isEqualTo("Kernel.rem(a, 2)");
            assertThat(print(binary(BinaryOp.BAND, var("a"), var("b")))).isEqualTo("Bitwise.band(a, b)");
            assertThat(print(new EUnary(LOC, UnaryOp.BNOT, var("a")))).isEqualTo("Bitwise.bnot(a)");
        }

        @Test
        @DisplayName("一元运算")
        void testUnary() {
            assertThat(print(new EUnary(LOC, UnaryOp.NOT, var("a")))).isEqualTo("not a");
            assertThat(print(new EUnary(LOC, UnaryOp.NEG, integer(-1)))).isEqualTo("-(-1)");
        }

        @Test
        @DisplayName("未降级的自增打印为重新绑定")
        void testLeftoverIncrement() {
            assertThat(print(new EUnary(LOC, UnaryOp.POST_INCREMENT, var("i")))).isEqualTo("i = i + 1");
        }

        @Test
        @DisplayName("管道左结合不加括号")
        void testPipeChain() {
            ElixirNode node = binary(BinaryOp.PIPE,
                    binary(BinaryOp.PIPE, var("xs"), remote("Enum", "sort")),
                    remote("Enum", "reverse"));
            assertThat(print(node)).isEqualTo("xs |> Enum.sort() |> Enum.reverse()");
        }

        @Test
        @DisplayName("带步长的区间")
        void testRange() {
            ElixirNode node = new ERange(LOC, integer(0), binary(BinaryOp.SUB, var("n"), integer(1)), integer(1));
            assertThat(print(node)).isEqualTo("0..(n - 1)//1");
        }
    }

    // ============ 字面量 ============

    @Nested
    @DisplayName("字面量")
    class Literals {

        @Test
        @DisplayName("字符串只转义五种字符")
        void testStringEscapes() {
            assertThat(print(string("a\"b\n\t\\"))).isEqualTo("\"a\\\"b\\n\\t\\\\\"");
            assertThat(print(string("#{x}"))).isEqualTo("\"#{x}\"");
        }

        @Test
        @DisplayName("浮点数使用小写指数")
        void testFloats() {
            assertThat(print(ELiteral.ofFloat(1.5))).isEqualTo("1.5");
            assertThat(print(ELiteral.ofFloat(1e20))).isEqualTo("1.0e20");
        }

        @Test
        @DisplayName("NaN 无法表示")
        void testNaNFails() {
            assertThatThrownBy(() -> print(ELiteral.ofFloat(Double.NaN)))
                    .isInstanceOf(InternalCompilerError.class);
        }

        @Test
        @DisplayName("原子必要时加引号")
        void testAtoms() {
            assertThat(print(atom("ok"))).isEqualTo(":ok");
            assertThat(print(atom("valid?"))).isEqualTo(":valid?");
            assertThat(print(atom("hello world"))).isEqualTo(":\"hello world\"");
        }

        @Test
        @DisplayName("原子键的 map 使用关键字语法")
        void testMaps() {
            ElixirNode keyword = new EMap(LOC, Arrays.asList(
                    new EMapEntry(atom("a"), integer(1)), new EMapEntry(atom("b"), integer(2))));
            ElixirNode arrows = new EMap(LOC, Collections.singletonList(new EMapEntry(string("a"), integer(1))));
            assertThat(print(keyword)).isEqualTo("%{a: 1, b: 2}");
            assertThat(print(arrows)).isEqualTo("%{\"a\" => 1}");
        }
    }

    // ============ 块与赋值 ============

    @Nested
    @DisplayName("块")
    class Blocks {

        @Test
        @DisplayName("表达式位置的多语句块打印为立即调用的匿名函数")
        void testBlockInExpressionPosition() {
            ElixirNode node = bind("a", block(bind("b", integer(1)), binary(BinaryOp.ADD, var("b"), integer(1))));
            assertThat(print(node)).isEqualTo("a = (fn ->\n  b = 1\n  b + 1\nend).()");
        }

        @Test
        @DisplayName("空块打印为 nil")
        void testEmptyBlock() {
            assertThat(print(block())).isEqualTo("nil");
        }

        @Test
        @DisplayName("未降级的字段赋值打印为结构更新")
        void testLeftoverFieldAssign() {
            ElixirNode node = new EAssign(LOC, new EField(LOC, var("struct"), "count"), null, integer(1));
            assertThat(print(node)).isEqualTo("struct = %{struct | count: 1}");
        }

        @Test
        @DisplayName("根节点为空时报内部错误")
        void testNullRoot() {
            assertThatThrownBy(() -> print(null)).isInstanceOf(InternalCompilerError.class);
        }
    }

    // ============ 函数与推导式 ============

    @Nested
    @DisplayName("函数")
    class Functions {

        @Test
        @DisplayName("单子句匿名函数")
        void testFn() {
            ElixirNode fn = new EFn(LOC, Collections.singletonList(new EFnClause(
                    Collections.<ElixirPattern>singletonList(pvar("x")), null,
                    binary(BinaryOp.MUL, var("x"), integer(2)))));
            assertThat(print(remote("Enum", "map", var("xs"), fn))).isEqualTo("Enum.map(xs, fn x -> x * 2 end)");
        }

        @Test
        @DisplayName("带过滤器的推导式")
        void testFor() {
            ElixirNode node = new EFor(LOC,
                    Collections.singletonList(new EForGenerator(pvar("x"), var("xs"))),
                    Collections.<ElixirNode>singletonList(binary(BinaryOp.GT, var("x"), integer(0))),
                    null, binary(BinaryOp.MUL, var("x"), integer(2)));
            assertThat(print(node)).isEqualTo("for x <- xs, x > 0, do: x * 2");
        }
    }

    @Test
    @DisplayName("结构相同的树规范文本相同")
    void testCanonicalIsStable() {
        ElixirNode a = binary(BinaryOp.ADD, var("a"), integer(1));
        ElixirNode b = binary(BinaryOp.ADD, var("a"), integer(1));
        assertThat(ElixirPrinter.canonical(a)).isEqualTo(ElixirPrinter.canonical(b));
    }
}
