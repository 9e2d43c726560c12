package com.exforge.cli;

import com.exforge.ir.pass.elixir.PipeIdioms;
import com.exforge.ir.pass.elixir.UsageHygiene;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PassConfigLoader 测试")
class PassConfigLoaderTest {

    private final PassConfigLoader loader = new PassConfigLoader();

    @Test
    @DisplayName("读取 pass 开关和缩进")
    void testParse() {
        CompilerSettings settings = loader.parse("{\"passes\": {\"pipe-idioms\": false}, \"indentSize\": 4}");
        assertThat(settings.getPassConfig().isEnabled(PipeIdioms.NAME)).isFalse();
        assertThat(settings.getPassConfig().isEnabled(UsageHygiene.NAME)).isTrue();
        assertThat(settings.getPrintConfig().getIndentSize()).isEqualTo(4);
    }

    @Test
    @DisplayName("空对象使用默认配置")
    void testEmptyObject() {
        CompilerSettings settings = loader.parse("{}");
        assertThat(settings.getPassConfig().getOverrides()).isEmpty();
        assertThat(settings.getPrintConfig().getIndentSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("未知 pass 名是配置错误")
    void testUnknownPass() {
        assertThatThrownBy(() -> loader.parse("{\"passes\": {\"inline-everything\": true}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inline-everything");
    }

    @Test
    @DisplayName("pass 开关必须是布尔值")
    void testNonBooleanSwitch() {
        assertThatThrownBy(() -> loader.parse("{\"passes\": {\"pipe-idioms\": \"off\"}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pipe-idioms");
        assertThatThrownBy(() -> loader.parse("{\"passes\": [\"pipe-idioms\"]}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("缩进必须是非负数")
    void testIndentSize() {
        assertThatThrownBy(() -> loader.parse("{\"indentSize\": \"wide\"}"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loader.parse("{\"indentSize\": -1}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("非法 JSON 和非对象根节点")
    void testMalformed() {
        assertThatThrownBy(() -> loader.parse("{"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("malformed");
        assertThatThrownBy(() -> loader.parse("[]"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("从文件加载")
    void testLoad(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("exforge.json");
        Files.write(file, "{\"indentSize\": 3}".getBytes(StandardCharsets.UTF_8));
        assertThat(loader.load(file).getPrintConfig().getIndentSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("文件不存在时抛出 IOException")
    void testMissingFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.json")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @DisplayName("已知 pass 名按流水线顺序排列")
    void testKnownPasses() {
        assertThat(PassConfigLoader.knownPasses()).hasSize(14).contains(PipeIdioms.NAME);
    }
}
