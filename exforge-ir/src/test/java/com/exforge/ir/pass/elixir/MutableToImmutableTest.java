package com.exforge.ir.pass.elixir;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.UnaryOp;
import com.exforge.ir.ast.control.EIf;
import com.exforge.ir.ast.control.EWhileLoop;
import com.exforge.ir.ast.expr.*;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.pass.PassContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.exforge.ir.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("MutableToImmutable 测试")
class MutableToImmutableTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    private static EAccess mapAccess(String name, ElixirNode key) {
        EAccess access = new EAccess(LOC, var(name), key);
        access.withMetadata(access.metadataWith(Metadata.MAP_ACCESS, true));
        return access;
    }

    private static ElixirNode lower(ElixirNode node) {
        return new MutableToImmutable().run(node, new PassContext());
    }

    private static String run(ElixirNode node) {
        return ElixirPrinter.canonical(lower(node));
    }

    private static ERemoteCall method(String receiver, String name, ElixirNode... args) {
        List<ElixirNode> list = new ArrayList<>();
        Collections.addAll(list, args);
        return new ERemoteCall(LOC, var(receiver), name, list);
    }

    // ============ 赋值 ============

    @Nested
    @DisplayName("赋值")
    class Assignments {

        @Test
        @DisplayName("复合赋值变成重新绑定")
        void testCompoundAssign() {
            ElixirNode result = lower(new EAssign(LOC, var("x"), BinaryOp.ADD, integer(1)));
            assertThat(result).isInstanceOf(EMatch.class);
            assertThat(ElixirPrinter.canonical(result)).isEqualTo("x = x + 1");
        }

        @Test
        @DisplayName("实例参数的字段赋值变成 map 更新")
        void testFieldAssign() {
            ElixirNode result = lower(new EAssign(LOC, new EField(LOC, var("struct"), "count"), null, integer(5)));
            assertThat(result).isInstanceOf(EMatch.class);
            assertThat(ElixirPrinter.canonical(result)).isEqualTo("struct = %{struct | count: 5}");
        }

        @Test
        @DisplayName("其他接收者的字段赋值保持原样")
        void testForeignFieldAssignUntouched() {
            EAssign assign = new EAssign(LOC, new EField(LOC, var("other"), "count"), null, integer(5));
            assertThat(lower(assign)).isInstanceOf(EAssign.class);
        }

        @Test
        @DisplayName("下标赋值变成 List.replace_at")
        void testIndexAssign() {
            ElixirNode tree = new EAssign(LOC, new EAccess(LOC, var("a"), var("i")), null, var("v"));
            assertThat(run(tree)).isEqualTo("a = List.replace_at(a, i, v)");
        }

        @Test
        @DisplayName("列表下标复合赋值用 Enum.at 读取旧值")
        void testIndexCompoundAssign() {
            ElixirNode tree = new EAssign(LOC, new EAccess(LOC, var("xs"), integer(0)), BinaryOp.ADD, integer(1));
            assertThat(run(tree)).isEqualTo("xs = List.replace_at(xs, 0, Enum.at(xs, 0) + 1)");
        }

        @Test
        @DisplayName("map 下标赋值变成 Map.put")
        void testMapAssign() {
            ElixirNode tree = new EAssign(LOC, mapAccess("scores", string("k")), null, integer(1));
            assertThat(run(tree)).isEqualTo("scores = Map.put(scores, \"k\", 1)");
        }

        @Test
        @DisplayName("map 下标复合赋值读取 m[k]")
        void testMapCompoundAssign() {
            ElixirNode tree = new EAssign(LOC, mapAccess("scores", string("k")), BinaryOp.ADD, integer(2));
            assertThat(run(tree)).isEqualTo("scores = Map.put(scores, \"k\", scores[\"k\"] + 2)");
        }
    }

    // ============ 语句位置的变更 ============

    @Nested
    @DisplayName("语句")
    class Statements {

        @Test
        @DisplayName("push 变成列表拼接")
        void testPush() {
            ElixirNode tree = block(method("xs", "push", integer(1)), var("xs"));
            assertThat(run(tree)).isEqualTo("xs = xs ++ [1]\nxs");
        }

        @Test
        @DisplayName("pop 变成 List.delete_at")
        void testPop() {
            ElixirNode tree = block(method("xs", "pop"), var("xs"));
            assertThat(run(tree)).isEqualTo("xs = List.delete_at(xs, -1)\nxs");
        }

        @Test
        @DisplayName("后置自增变成重新绑定")
        void testPostIncrement() {
            ElixirNode tree = block(new EUnary(LOC, UnaryOp.POST_INCREMENT, var("i")), var("i"));
            ElixirNode result = lower(tree);
            assertThat(((EBlock) result).getStatements().get(0)).isInstanceOf(EMatch.class);
            assertThat(ElixirPrinter.canonical(result)).isEqualTo("i = i + 1\ni");
        }

        @Test
        @DisplayName("if 分支中的 push")
        void testPushInBranch() {
            ElixirNode tree = new EIf(LOC, var("c"), method("xs", "push", integer(1)), null);
            assertThat(run(tree)).isEqualTo("if c do\n  xs = xs ++ [1]\nend");
        }

        @Test
        @DisplayName("循环体中的自减")
        void testDecrementInLoop() {
            ElixirNode tree = new EWhileLoop(LOC, binary(BinaryOp.GT, var("n"), integer(0)),
                    new EUnary(LOC, UnaryOp.POST_DECREMENT, var("n")));
            EWhileLoop loop = (EWhileLoop) lower(tree);
            assertThat(ElixirPrinter.canonical(loop.getBody())).isEqualTo("n = n - 1");
        }

        @Test
        @DisplayName("表达式位置的 push 不改写")
        void testPushAsArgumentUntouched() {
            ElixirNode tree = call("f", method("xs", "push", integer(1)));
            assertThat(run(tree)).isEqualTo("f(xs.push(1))");
        }
    }
}
