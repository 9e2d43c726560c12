package com.exforge.ir.pass.elixir;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.control.ECase;
import com.exforge.ir.ast.control.ECaseClause;
import com.exforge.ir.ast.expr.ELiteral;
import com.exforge.ir.ast.pattern.PLiteral;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.pass.PassContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static com.exforge.ir.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("EnumTagPatterns 测试")
class EnumTagPatternsTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    private static String run(ElixirNode node) {
        return ElixirPrinter.canonical(new EnumTagPatterns().run(node, new PassContext()));
    }

    private static ECaseClause tagClause(long tag, ElixirNode body) {
        return new ECaseClause(new PLiteral(LOC, ELiteral.ofInt(tag)), body);
    }

    private static ElixirNode elem(String subject, long index) {
        return call("elem", var(subject), integer(index));
    }

    // ============ 改写 ============

    @Nested
    @DisplayName("改写")
    class Rewrites {

        @Test
        @DisplayName("载荷提取移入元组模式")
        void testPayloadMovesIntoPattern() {
            ElixirNode tree = new ECase(LOC, elem("x", 0), Arrays.asList(
                    tagClause(0, block(bind("v", elem("x", 1)), var("v"))),
                    tagClause(1, atom("none"))));
            assertThat(run(tree)).isEqualTo("case x do\n  {0, v} -> v\n  {1} -> :none\nend");
        }

        @Test
        @DisplayName("元数取自元数据，未提取位置用通配")
        void testArityFromMetadata() {
            Map<Long, Integer> arities = new HashMap<>();
            arities.put(0L, 3);
            ECase tree = new ECase(LOC, elem("x", 0), Arrays.asList(
                    tagClause(0, block(bind("v", elem("x", 1)), var("v"))),
                    new ECaseClause(wildcard(), nil())))
                    .withMetadata(Metadata.of(Metadata.ENUM_ARITIES, arities));
            assertThat(run(tree)).isEqualTo("case x do\n  {0, v, _} -> v\n  _ -> nil\nend");
        }

        @Test
        @DisplayName("Kernel.elem 同样识别")
        void testQualifiedElem() {
            ElixirNode tree = new ECase(LOC, remote("Kernel", "elem", var("x"), integer(0)), Arrays.asList(
                    tagClause(2, block(bind("a", remote("Kernel", "elem", var("x"), integer(2))), var("a")))));
            assertThat(run(tree)).isEqualTo("case x do\n  {2, _, a} -> a\nend");
        }
    }

    // ============ 保持原样 ============

    @Nested
    @DisplayName("保持原样")
    class Declines {

        @Test
        @DisplayName("主体不是 elem(x, 0)")
        void testOtherSubject() {
            ElixirNode tree = new ECase(LOC, var("x"), Arrays.asList(tagClause(0, atom("a"))));
            assertThat(run(tree)).isEqualTo("case x do\n  0 -> :a\nend");
        }

        @Test
        @DisplayName("变量子句使用了标签值")
        void testCatchAllUsesTag() {
            ElixirNode tree = new ECase(LOC, elem("x", 0), Arrays.asList(
                    tagClause(0, atom("a")),
                    new ECaseClause(pvar("t"), var("t"))));
            assertThat(run(tree)).isEqualTo(ElixirPrinter.canonical(tree));
        }

        @Test
        @DisplayName("同一下标提取到不同名字")
        void testConflictingExtraction() {
            ElixirNode tree = new ECase(LOC, elem("x", 0), Arrays.asList(
                    tagClause(0, block(bind("a", elem("x", 1)), bind("b", elem("x", 1)), var("a")))));
            assertThat(run(tree)).isEqualTo(ElixirPrinter.canonical(tree));
        }
    }
}
