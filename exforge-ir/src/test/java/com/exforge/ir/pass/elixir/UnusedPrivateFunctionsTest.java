package com.exforge.ir.pass.elixir;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.decl.EAttribute;
import com.exforge.ir.ast.decl.EDef;
import com.exforge.ir.ast.decl.EModule;
import com.exforge.ir.ast.expr.ERaw;
import com.exforge.ir.ast.pattern.ElixirPattern;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.pass.PassContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.exforge.ir.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("UnusedPrivateFunctions 测试")
class UnusedPrivateFunctionsTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    private static EModule annotate(EModule module) {
        return (EModule) new UnusedPrivateFunctions().run(module, new PassContext());
    }

    private static EDef def(EDef.DefKind kind, String name, ElixirNode body, ElixirPattern... params) {
        return new EDef(LOC, kind, name, Arrays.asList(params), null, body);
    }

    private static EModule module(ElixirNode... body) {
        return new EModule(LOC, "M", Arrays.asList(body));
    }

    // ============ 标注 ============

    @Nested
    @DisplayName("标注")
    class Annotates {

        @Test
        @DisplayName("未调用的 defp 记入元数据并插入 @compile")
        void testUnusedRecorded() {
            EModule result = annotate(module(
                    def(EDef.DefKind.DEF, "a", call("b")),
                    def(EDef.DefKind.DEFP, "b", integer(1)),
                    def(EDef.DefKind.DEFP, "c", integer(2))));
            assertThat(result.meta(Metadata.UNUSED_PRIVATE_FUNCTIONS)).containsExactly("c/0");
            assertThat(result.getBody().get(0)).isInstanceOf(EAttribute.class);
            assertThat(ElixirPrinter.canonical(result)).isEqualTo("defmodule M do\n"
                    + "  @compile {:nowarn_unused_function, [c: 0]}\n"
                    + "\n"
                    + "  def a(), do: b()\n"
                    + "\n"
                    + "  defp b(), do: 1\n"
                    + "\n"
                    + "  defp c(), do: 2\n"
                    + "end");
        }

        @Test
        @DisplayName("自身递归调用不算使用")
        void testSelfRecursionIgnored() {
            EModule result = annotate(module(
                    def(EDef.DefKind.DEFP, "loop", call("loop", binary(BinaryOp.SUB, var("n"), integer(1))),
                            pvar("n"))));
            assertThat(result.meta(Metadata.UNUSED_PRIVATE_FUNCTIONS)).containsExactly("loop/1");
        }
    }

    // ============ 视为已使用 ============

    @Nested
    @DisplayName("视为已使用")
    class Used {

        @Test
        @DisplayName("管道右侧的调用元数加一")
        void testPipeArity() {
            EModule result = annotate(module(
                    def(EDef.DefKind.DEF, "a", binary(BinaryOp.PIPE, var("xs"), call("helper")), pvar("xs")),
                    def(EDef.DefKind.DEFP, "helper", var("x"), pvar("x"))));
            assertThat(result.meta(Metadata.UNUSED_PRIVATE_FUNCTIONS)).isNull();
            assertThat(result.getBody()).hasSize(2);
        }

        @Test
        @DisplayName("原样代码中的函数捕获")
        void testCaptureInRaw() {
            EModule result = annotate(module(
                    def(EDef.DefKind.DEF, "a", new ERaw(LOC, "Enum.map(xs, &helper/1)")),
                    def(EDef.DefKind.DEFP, "helper", var("x"), pvar("x"))));
            assertThat(result.meta(Metadata.UNUSED_PRIVATE_FUNCTIONS)).isNull();
        }

        @Test
        @DisplayName("对本模块的限定调用")
        void testQualifiedSelfCall() {
            EModule result = annotate(module(
                    def(EDef.DefKind.DEF, "a", remote("M", "helper")),
                    def(EDef.DefKind.DEFP, "helper", integer(1))));
            assertThat(result.meta(Metadata.UNUSED_PRIVATE_FUNCTIONS)).isNull();
        }
    }

    @Test
    @DisplayName("已有 nowarn 属性的模块不变")
    void testExistingAttributeKept() {
        EModule first = annotate(module(def(EDef.DefKind.DEFP, "c", integer(2))));
        EModule second = annotate(first);
        assertThat(second.getBody()).hasSize(2);
    }
}
