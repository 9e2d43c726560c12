package com.exforge.ir.pass.elixir;

import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.pass.PassContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.exforge.ir.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("RedundantNilInit 测试")
class RedundantNilInitTest {

    private static String run(ElixirNode node) {
        return ElixirPrinter.canonical(new RedundantNilInit().run(node, new PassContext()));
    }

    @Test
    @DisplayName("随后被覆盖的 nil 初始化被删除")
    void testRemovesOverwrittenInit() {
        ElixirNode tree = block(bind("x", nil()), bind("y", integer(2)), bind("x", integer(5)), var("x"));
        assertThat(run(tree)).isEqualTo("y = 2\nx = 5\nx");
    }

    @Test
    @DisplayName("重复的 nil 初始化一并删除")
    void testRepeatedNilInit() {
        ElixirNode tree = block(bind("x", nil()), bind("x", nil()), bind("x", integer(1)), var("x"));
        assertThat(run(tree)).isEqualTo("x = 1\nx");
    }

    @Test
    @DisplayName("覆盖之前被读取则保留")
    void testReadBeforeOverwrite() {
        ElixirNode tree = block(bind("x", nil()), call("inspect", var("x")), bind("x", integer(5)), var("x"));
        assertThat(run(tree)).isEqualTo("x = nil\ninspect(x)\nx = 5\nx");
    }

    @Test
    @DisplayName("新值读取自身时保留")
    void testSelfReferencingOverwrite() {
        ElixirNode tree = block(bind("x", nil()), bind("x", call("f", var("x"))), var("x"));
        assertThat(run(tree)).isEqualTo("x = nil\nx = f(x)\nx");
    }

    @Test
    @DisplayName("最后一条语句不删除")
    void testTrailingInitKept() {
        ElixirNode tree = block(bind("y", binary(BinaryOp.ADD, var("a"), integer(1))), bind("x", nil()));
        assertThat(run(tree)).isEqualTo("y = a + 1\nx = nil");
    }
}
