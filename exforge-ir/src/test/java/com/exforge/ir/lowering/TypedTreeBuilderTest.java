package com.exforge.ir.lowering;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.compiler.ast.TVariable;
import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.ast.expr.*;
import com.exforge.compiler.ast.expr.TBinop.TBinaryOp;
import com.exforge.compiler.ast.expr.TUnop.TUnaryOp;
import com.exforge.compiler.ast.type.TypeRef;
import com.exforge.ir.ast.BinaryOp;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.UnaryOp;
import com.exforge.ir.ast.control.EWhileLoop;
import com.exforge.ir.ast.decl.EModule;
import com.exforge.ir.ast.expr.EAssign;
import com.exforge.ir.ast.expr.EBlock;
import com.exforge.ir.ast.expr.EField;
import com.exforge.ir.ast.expr.EUnary;
import com.exforge.ir.backend.ElixirPrinter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TypedTreeBuilder 测试")
class TypedTreeBuilderTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    private final TVariable a = new TVariable(1, "a");
    private final TVariable n = new TVariable(2, "n", TypeRef.INT);
    private final TVariable xs = new TVariable(3, "xs", TypeRef.arrayOf(TypeRef.INT));
    private final TVariable s = new TVariable(4, "s", TypeRef.STRING);
    private final TVariable scores = new TVariable(5, "scores", new TypeRef("Map"));
    private final TVariable userName = new TVariable(6, "userName");

    private static ElixirNode build(TypedExpr expr) {
        return new TypedTreeBuilder().build(expr);
    }

    private static String print(TypedExpr expr) {
        return ElixirPrinter.canonical(build(expr));
    }

    private static TLocal local(TVariable variable) {
        return new TLocal(variable);
    }

    // ============ 常量与变量 ============

    @Nested
    @DisplayName("常量与变量")
    class Constants {

        @Test
        @DisplayName("各类常量")
        void testConstants() {
            assertThat(print(TConst.ofInt(42))).isEqualTo("42");
            assertThat(print(TConst.ofString("hi"))).isEqualTo("\"hi\"");
            assertThat(print(TConst.ofBool(true))).isEqualTo("true");
            assertThat(print(TConst.ofNull())).isEqualTo("nil");
            assertThat(print(TConst.ofThis(new TypeRef("Point")))).isEqualTo("struct");
        }

        @Test
        @DisplayName("变量名转换为 snake_case")
        void testLocalNaming() {
            assertThat(print(local(userName))).isEqualTo("user_name");
            assertThat(print(new TVar(userName, TConst.ofInt(1)))).isEqualTo("user_name = 1");
        }

        @Test
        @DisplayName("没有初值的声明绑定 nil")
        void testVarWithoutInit() {
            assertThat(print(new TVar(a, null))).isEqualTo("a = nil");
        }

        @Test
        @DisplayName("null 输入返回 null")
        void testNullInput() {
            assertThat(build(null)).isNull();
        }
    }

    // ============ 运算符 ============

    @Nested
    @DisplayName("运算符")
    class Operators {

        @Test
        @DisplayName("字符串拼接转换非字符串操作数")
        void testStringConcat() {
            TBinop concat = new TBinop(TBinaryOp.ADD, TConst.ofString("n="), local(n));
            assertThat(print(concat)).isEqualTo("\"n=\" <> to_string(n)");
        }

        @Test
        @DisplayName("区间转换为步长 1 的 range")
        void testInterval() {
            assertThat(print(new TBinop(TBinaryOp.INTERVAL, TConst.ofInt(0), local(n))))
                    .isEqualTo("0..(n - 1)//1");
        }

        @Test
        @DisplayName("取模使用 Kernel.rem")
        void testModulo() {
            assertThat(print(new TBinop(TBinaryOp.MOD, local(n), TConst.ofInt(2)))).isEqualTo("Kernel.rem(n, 2)");
        }

        @Test
        @DisplayName("局部变量的空值合并转换为 if")
        void testNullCoalesceLocal() {
            assertThat(print(new TBinop(TBinaryOp.NULL_COALESCE, local(a), TConst.ofInt(0))))
                    .isEqualTo("if a != nil, do: a, else: 0");
        }

        @Test
        @DisplayName("其他表达式的空值合并转换为 case")
        void testNullCoalesceExpression() {
            TBinop coalesce = new TBinop(TBinaryOp.NULL_COALESCE, TCall.method(local(a), "get"), TConst.ofInt(0));
            assertThat(print(coalesce)).isEqualTo("case a.get() do\n  nil -> 0\n  value_0 -> value_0\nend");
        }

        @Test
        @DisplayName("局部变量赋值转换为匹配")
        void testLocalAssign() {
            assertThat(print(new TBinop(TBinaryOp.ASSIGN, local(a), TConst.ofInt(1)))).isEqualTo("a = 1");
        }

        @Test
        @DisplayName("字段赋值保留为 EAssign")
        void testFieldAssign() {
            ElixirNode node = build(new TBinop(TBinaryOp.ASSIGN, new TField(local(a), "count"), TConst.ofInt(1)));
            assertThat(node).isInstanceOf(EAssign.class);
            assertThat(((EAssign) node).getTarget()).isInstanceOf(EField.class);
            assertThat(((EAssign) node).getOperator()).isNull();
        }

        @Test
        @DisplayName("下标写入区分 map 与列表")
        void testIndexWriteTarget() {
            ElixirNode mapWrite = build(new TBinop(TBinaryOp.ASSIGN,
                    new TArrayAccess(local(scores), TConst.ofString("k")), TConst.ofInt(1)));
            ElixirNode listWrite = build(new TBinop(TBinaryOp.ASSIGN,
                    new TArrayAccess(local(xs), TConst.ofInt(0)), TConst.ofInt(1)));
            assertThat(((EAssign) mapWrite).getTarget().hasFlag(Metadata.MAP_ACCESS)).isTrue();
            assertThat(((EAssign) listWrite).getTarget().hasFlag(Metadata.MAP_ACCESS)).isFalse();
        }

        @Test
        @DisplayName("复合赋值记录运算符")
        void testCompoundAssign() {
            TBinop compound = new TBinop(LOC, TypeRef.INT, TBinaryOp.ASSIGN_OP, TBinaryOp.ADD, local(n),
                    TConst.ofInt(2));
            ElixirNode node = build(compound);
            assertThat(node).isInstanceOf(EAssign.class);
            assertThat(((EAssign) node).getOperator()).isEqualTo(BinaryOp.ADD);
        }

        @Test
        @DisplayName("一元运算")
        void testUnary() {
            ElixirNode increment = build(new TUnop(TUnaryOp.INCREMENT, true, local(n)));
            assertThat(((EUnary) increment).getOperator()).isEqualTo(UnaryOp.POST_INCREMENT);
            assertThat(print(new TUnop(TUnaryOp.NOT, false, local(a)))).isEqualTo("not a");
            assertThat(print(new TUnop(TUnaryOp.NEG_BITS, false, local(n)))).isEqualTo("Bitwise.bnot(n)");
        }
    }

    // ============ 调用与访问 ============

    @Nested
    @DisplayName("调用与访问")
    class Calls {

        @Test
        @DisplayName("数组下标读取使用 Enum.at")
        void testArrayRead() {
            assertThat(print(new TArrayAccess(local(xs), TConst.ofInt(0)))).isEqualTo("Enum.at(xs, 0)");
        }

        @Test
        @DisplayName("Map 下标读取使用访问语法")
        void testMapRead() {
            assertThat(print(new TArrayAccess(local(scores), TConst.ofString("k")))).isEqualTo("scores[\"k\"]");
        }

        @Test
        @DisplayName("length 按接收者类型转换")
        void testLength() {
            assertThat(print(new TField(local(xs), "length"))).isEqualTo("length(xs)");
            assertThat(print(new TField(local(s), "length"))).isEqualTo("String.length(s)");
        }

        @Test
        @DisplayName("数组与字符串的库方法")
        void testLibraryCalls() {
            assertThat(print(TCall.method(local(xs), "map", local(a)))).isEqualTo("Enum.map(xs, a)");
            assertThat(print(TCall.method(local(xs), "contains", TConst.ofInt(1)))).isEqualTo("Enum.member?(xs, 1)");
            assertThat(print(TCall.method(local(s), "toUpperCase"))).isEqualTo("String.upcase(s)");
        }

        @Test
        @DisplayName("this 上的方法调用传入实例参数")
        void testThisCall() {
            TCall call = TCall.method(TConst.ofThis(new TypeRef("Point")), "moveBy", TConst.ofInt(1));
            assertThat(print(call)).isEqualTo("move_by(struct, 1)");
        }

        @Test
        @DisplayName("类型上的静态调用")
        void testStaticCall() {
            assertThat(print(TCall.method(new TTypeExpr("math.util"), "max", local(a), local(n))))
                    .isEqualTo("Math.Util.max(a, n)");
        }

        @Test
        @DisplayName("对象字面量转换为原子键 map")
        void testObjectDecl() {
            TObjectDecl object = new TObjectDecl(Arrays.asList(
                    new TObjectDecl.ObjectField("firstName", TConst.ofString("x")),
                    new TObjectDecl.ObjectField("age", TConst.ofInt(1))));
            assertThat(print(object)).isEqualTo("%{first_name: \"x\", age: 1}");
        }

        @Test
        @DisplayName("匿名函数")
        void testFunction() {
            TFunction fn = new TFunction(Collections.singletonList(a), local(a));
            assertThat(print(fn)).isEqualTo("fn a -> a end");
        }

        @Test
        @DisplayName("throw 转换为 raise")
        void testThrow() {
            assertThat(print(new TThrow(LOC, TConst.ofString("bad")))).isEqualTo("raise(\"bad\")");
        }
    }

    // ============ 控制流 ============

    @Nested
    @DisplayName("控制流")
    class ControlFlow {

        @Test
        @DisplayName("值 switch 总是带 _ 子句")
        void testValueSwitch() {
            TSwitch sw = new TSwitch(LOC, TypeRef.STRING, local(n),
                    Collections.singletonList(new TSwitch.SwitchCase(
                            Collections.<TypedExpr>singletonList(TConst.ofInt(1)), TConst.ofString("one"))),
                    null);
            assertThat(print(sw)).isEqualTo("case n do\n  1 -> \"one\"\n  _ -> nil\nend");
        }

        @Test
        @DisplayName("非常量 case 值使用相等守卫")
        void testValueSwitchGuard() {
            TSwitch sw = new TSwitch(LOC, TypeRef.STRING, local(n),
                    Collections.singletonList(new TSwitch.SwitchCase(
                            Collections.<TypedExpr>singletonList(local(a)), TConst.ofString("same"))),
                    TConst.ofString("other"));
            assertThat(print(sw)).isEqualTo(
                    "case n do\n  value_0 when value_0 == a -> \"same\"\n  _ -> \"other\"\nend");
        }

        @Test
        @DisplayName("枚举 switch 记录构造器元数和子句局部名")
        void testEnumSwitch() {
            TVariable temp = new TVariable(10, "_g");
            TVariable value = new TVariable(11, "value");
            TEnumParameter parameter = new TEnumParameter(LOC, TypeRef.DYNAMIC, local(a), "Some", 0, 1);
            TSwitch sw = new TSwitch(LOC, TypeRef.DYNAMIC, new TEnumIndex(local(a)), Arrays.asList(
                    new TSwitch.SwitchCase(Collections.<TypedExpr>singletonList(TConst.ofInt(0)),
                            TBlock.of(new TVar(temp, parameter), new TVar(value, local(temp)), local(value))),
                    new TSwitch.SwitchCase(Collections.<TypedExpr>singletonList(TConst.ofInt(1)),
                            TConst.ofNull())),
                    null);
            ElixirNode node = build(sw);

            Map<Long, Integer> arities = node.meta(Metadata.ENUM_ARITIES);
            assertThat(arities).containsEntry(0L, 2).hasSize(1);
            String printed = ElixirPrinter.canonical(node);
            assertThat(printed).startsWith("case elem(a, 0) do\n");
            assertThat(printed).contains("_g = elem(a, 1)").contains("1 -> nil").doesNotContain("_ ->");
        }

        @Test
        @DisplayName("do-while 先执行一次循环体")
        void testDoWhile() {
            TWhile loop = new TWhile(LOC, local(a), TCall.method(local(a), "step"), false);
            ElixirNode node = build(loop);
            assertThat(node).isInstanceOf(EBlock.class);
            assertThat(((EBlock) node).getStatements()).hasSize(2);
            assertThat(((EBlock) node).getStatements().get(1)).isInstanceOf(EWhileLoop.class);
        }

        @Test
        @DisplayName("普通 while 转换为 EWhileLoop")
        void testWhile() {
            assertThat(build(new TWhile(local(a), TCall.method(local(a), "step")))).isInstanceOf(EWhileLoop.class);
        }

        @Test
        @DisplayName("return 只保留返回值")
        void testReturn() {
            assertThat(print(new TReturn(LOC, local(a)))).isEqualTo("a");
            assertThat(print(new TReturn(LOC, null))).isEqualTo("nil");
        }

        @Test
        @DisplayName(":unrolled 元数据标记块")
        void testUnrolledMeta() {
            ElixirNode flagged = build(new TMeta(TMeta.UNROLLED, TBlock.of(TConst.ofInt(1), TConst.ofInt(2))));
            assertThat(flagged.hasFlag(Metadata.UNROLLED_LOOP)).isTrue();
            ElixirNode plain = build(new TMeta(":keep", TBlock.of(TConst.ofInt(1), TConst.ofInt(2))));
            assertThat(plain.hasFlag(Metadata.UNROLLED_LOOP)).isFalse();
        }

        @Test
        @DisplayName("模式优先于逐节点降级")
        void testPatternFirst() {
            TBlock block = TBlock.of(new TVar(a, TCall.method(local(scores), "get")),
                    new TBinop(TBinaryOp.NULL_COALESCE, local(a), TConst.ofInt(0)));
            assertThat(print(block)).isEqualTo("case scores.get() do\n  nil -> 0\n  a -> a\nend");
        }
    }

    // ============ 声明 ============

    @Nested
    @DisplayName("类声明")
    class Classes {

        @Test
        @DisplayName("类转换为带 defstruct 的模块")
        void testClass() {
            TClassDecl.TMethod getter = new TClassDecl.TMethod("getX", false, true, Collections.<TVariable>emptyList(),
                    new TReturn(LOC, new TField(TConst.ofThis(new TypeRef("Point")), "x")));
            TClassDecl.TMethod helper = new TClassDecl.TMethod("helper", true, false,
                    Collections.singletonList(a), local(a));
            TClassDecl decl = new TClassDecl(LOC, "geo.Point", Arrays.asList("x", "y"),
                    Arrays.asList(getter, helper), false);
            assertThat(print(decl)).isEqualTo("defmodule Geo.Point do\n"
                    + "  defstruct [:x, :y]\n"
                    + "\n"
                    + "  def get_x(struct), do: struct.x\n"
                    + "\n"
                    + "  defp helper(a), do: a\n"
                    + "end");
        }

        @Test
        @DisplayName("异常类记录异常元数据且不生成 defstruct")
        void testExceptionClass() {
            TClassDecl decl = new TClassDecl(LOC, "BadInput", Arrays.asList("message", "inputCode"),
                    Collections.<TClassDecl.TMethod>emptyList(), true);
            ElixirNode node = build(decl);
            assertThat(node).isInstanceOf(EModule.class);
            assertThat(node.hasFlag(Metadata.EXCEPTION_MODULE)).isTrue();
            assertThat(node.meta(Metadata.EXCEPTION_FIELDS)).containsExactly("message", "input_code");
            assertThat(((EModule) node).getBody()).isEmpty();
        }
    }
}
