package com.exforge.cli;

import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CLI 测试")
class MainTest {

    private static final String CALC = "{'kind': 'class', 'name': 'Calc', 'methods': [{'name': 'add', 'static': true,"
            + " 'args': [{'id': 1, 'name': 'a', 'type': 'Int'}, {'id': 2, 'name': 'b', 'type': 'Int'}],"
            + " 'body': {'kind': 'return', 'value': {'kind': 'binop', 'op': 'add',"
            + " 'left': {'kind': 'local', 'var': {'id': 1, 'name': 'a', 'type': 'Int'}},"
            + " 'right': {'kind': 'local', 'var': {'id': 2, 'name': 'b', 'type': 'Int'}}}}}]}";

    /** 枚举 switch 的 case 值不是构造器下标，构建阶段报内部错误 */
    private static final String BROKEN_ENUM_SWITCH = "{'kind': 'switch',"
            + " 'subject': {'kind': 'enumIndex', 'target': {'kind': 'local', 'var': {'id': 1, 'name': 'opt'}}},"
            + " 'cases': [{'values': [{'kind': 'const', 'const': 'string', 'value': 'a'}],"
            + " 'body': {'kind': 'const', 'const': 'null'}}]}";

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(String... args) {
        CommandLine cmd = Main.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path writeJson(String name, String text) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, text.replace('\'', '"').getBytes(StandardCharsets.UTF_8));
        return file;
    }

    // ============ transpile ============

    @Nested
    @DisplayName("transpile 子命令")
    class Transpile {

        @Test
        @DisplayName("默认输出到标准输出")
        void testStdout() throws Exception {
            Path input = writeJson("calc.json", CALC);
            assertThat(execute("transpile", input.toString())).isEqualTo(0);
            assertThat(out.toString()).isEqualTo("defmodule Calc do\n  def add(a, b), do: a + b\nend");
        }

        @Test
        @DisplayName("-o 写入文件并创建目录")
        void testOutputFile() throws Exception {
            Path input = writeJson("calc.json", CALC);
            Path output = tempDir.resolve("lib").resolve("calc.ex");
            assertThat(execute("transpile", input.toString(), "-o", output.toString())).isEqualTo(0);
            assertThat(out.toString()).isEmpty();
            String written = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
            assertThat(written).isEqualTo("defmodule Calc do\n  def add(a, b), do: a + b\nend");
        }

        @Test
        @DisplayName("--indent-size 覆盖配置文件")
        void testIndentOverride() throws Exception {
            Path input = writeJson("calc.json", CALC);
            Path config = writeJson("exforge.json", "{'indentSize': 3}");
            assertThat(execute("transpile", input.toString(), "--config", config.toString(),
                    "--indent-size", "4")).isEqualTo(0);
            assertThat(out.toString()).contains("\n    def add(a, b)");
        }

        @Test
        @DisplayName("配置文件设置缩进")
        void testConfigFile() throws Exception {
            Path input = writeJson("calc.json", CALC);
            Path config = writeJson("exforge.json", "{'indentSize': 3, 'passes': {'pipe-idioms': false}}");
            assertThat(execute("transpile", input.toString(), "--config", config.toString())).isEqualTo(0);
            assertThat(out.toString()).contains("\n   def add(a, b)");
        }

        @Test
        @DisplayName("禁用已知 pass")
        void testDisablePass() throws Exception {
            Path input = writeJson("calc.json", CALC);
            assertThat(execute("transpile", input.toString(), "--disable-pass", "pipe-idioms")).isEqualTo(0);
        }
    }

    // ============ 退出码 ============

    @Nested
    @DisplayName("退出码")
    class ExitCodes {

        @Test
        @DisplayName("未知 pass 名返回 2")
        void testUnknownPass() throws Exception {
            Path input = writeJson("calc.json", CALC);
            assertThat(execute("transpile", input.toString(), "--disable-pass", "nope"))
                    .isEqualTo(TranspileCommand.EXIT_USAGE);
            assertThat(err.toString()).contains("unknown pass 'nope'");
        }

        @Test
        @DisplayName("输入文件不存在返回 2")
        void testMissingInput() {
            assertThat(execute("transpile", tempDir.resolve("missing.json").toString()))
                    .isEqualTo(TranspileCommand.EXIT_USAGE);
            assertThat(err.toString()).contains("无法读写文件");
        }

        @Test
        @DisplayName("非法 JSON 返回 2")
        void testMalformedInput() throws Exception {
            Path input = writeJson("bad.json", "{'kind': ");
            assertThat(execute("transpile", input.toString())).isEqualTo(TranspileCommand.EXIT_USAGE);
            assertThat(err.toString()).contains("bad.json");
        }

        @Test
        @DisplayName("内部错误返回 3")
        void testInternalError() throws Exception {
            Path input = writeJson("switch.json", BROKEN_ENUM_SWITCH);
            assertThat(execute("transpile", input.toString())).isEqualTo(TranspileCommand.EXIT_INTERNAL);
            assertThat(err.toString()).contains("内部错误").contains("[typed-tree-builder]");
        }

        @Test
        @DisplayName("缺少参数时 picocli 返回用法错误")
        void testMissingParameter() {
            assertThat(execute("transpile")).isEqualTo(CommandLine.ExitCode.USAGE);
        }
    }

    // ============ 其他命令 ============

    @Nested
    @DisplayName("其他命令")
    class OtherCommands {

        @Test
        @DisplayName("passes 按顺序列出流水线")
        void testPasses() {
            assertThat(execute("passes")).isEqualTo(0);
            List<ElixirPass> passes = PassPipeline.createDefault().getPasses();
            String[] lines = out.toString().split("\\R");
            assertThat(lines).hasSize(passes.size());
            assertThat(lines[0]).isEqualTo(" 1. " + passes.get(0).getName());
            assertThat(lines[13]).isEqualTo("14. " + passes.get(13).getName());
        }

        @Test
        @DisplayName("无子命令时打印用法")
        void testUsage() {
            assertThat(execute()).isEqualTo(0);
            assertThat(out.toString()).contains("transpile").contains("passes");
        }

        @Test
        @DisplayName("--version")
        void testVersion() {
            assertThat(execute("--version")).isEqualTo(0);
            assertThat(out.toString()).contains("exforge 0.1.0");
        }
    }
}
