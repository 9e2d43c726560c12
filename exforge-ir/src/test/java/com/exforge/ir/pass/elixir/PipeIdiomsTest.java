package com.exforge.ir.pass.elixir;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.pass.PassContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.exforge.ir.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("PipeIdioms 测试")
class PipeIdiomsTest {

    private static String run(ElixirNode node) {
        return ElixirPrinter.canonical(new PipeIdioms().run(node, new PassContext()));
    }

    @Test
    @DisplayName("两层调用改写为管道")
    void testTwoLevels() {
        ElixirNode tree = remote("Enum", "map", remote("Enum", "filter", var("xs"), var("f")), var("g"));
        assertThat(run(tree)).isEqualTo("xs |> Enum.filter(f) |> Enum.map(g)");
    }

    @Test
    @DisplayName("三层调用接成一条管道")
    void testThreeLevels() {
        ElixirNode tree = remote("Enum", "sum",
                remote("Enum", "map", remote("Enum", "filter", var("xs"), var("f")), var("g")));
        assertThat(run(tree)).isEqualTo("xs |> Enum.filter(f) |> Enum.map(g) |> Enum.sum()");
    }

    @Test
    @DisplayName("单层调用不改写")
    void testSingleCall() {
        ElixirNode tree = remote("Enum", "map", var("xs"), var("g"));
        assertThat(run(tree)).isEqualTo("Enum.map(xs, g)");
    }

    @Test
    @DisplayName("最内层来源不是平凡表达式时不改写")
    void testNonTrivialSource() {
        ElixirNode tree = remote("Enum", "map", remote("Enum", "filter", call("load"), var("f")), var("g"));
        assertThat(run(tree)).isEqualTo("Enum.map(Enum.filter(load(), f), g)");
    }
}
