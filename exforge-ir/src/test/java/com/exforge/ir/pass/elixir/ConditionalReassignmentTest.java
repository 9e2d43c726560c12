package com.exforge.ir.pass.elixir;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.control.EIf;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.pass.PassContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.exforge.ir.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("ConditionalReassignment 测试")
class ConditionalReassignmentTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    private static String run(ElixirNode node) {
        return ElixirPrinter.canonical(new ConditionalReassignment().run(node, new PassContext()));
    }

    @Test
    @DisplayName("无 else 的条件更新变成带 else 的重新绑定")
    void testRewritesConditionalUpdate() {
        ElixirNode tree = new EIf(LOC, var("c"), bind("x", binary(BinaryOp.ADD, var("x"), integer(1))), null);
        assertThat(run(tree)).isEqualTo("x = if c, do: x + 1, else: x");
    }

    @Test
    @DisplayName("else 为 nil 视同没有 else")
    void testNilElse() {
        ElixirNode tree = new EIf(LOC, var("c"), block(bind("x", call("f", var("x")))), nil());
        assertThat(run(tree)).isEqualTo("x = if c, do: f(x), else: x");
    }

    @Test
    @DisplayName("已有 else 分支时不改写")
    void testExistingElse() {
        ElixirNode tree = new EIf(LOC, var("c"), bind("x", call("f", var("x"))), integer(0));
        assertThat(run(tree)).isEqualTo(ElixirPrinter.canonical(tree));
    }

    @Test
    @DisplayName("右侧不引用自身时不改写")
    void testValueIndependentOfTarget() {
        ElixirNode tree = new EIf(LOC, var("c"), bind("x", integer(1)), null);
        assertThat(run(tree)).isEqualTo("if c do\n  x = 1\nend");
    }
}
