package com.exforge.compiler.naming;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ElixirNaming 测试")
class ElixirNamingTest {

    private final ElixirNaming naming = new ElixirNaming();

    // ============ 标识符 ============

    @Nested
    @DisplayName("标识符")
    class Identifiers {

        @Test
        @DisplayName("camelCase 转换为 snake_case")
        void testCamelCase() {
            assertThat(naming.toElixirName("userName")).isEqualTo("user_name");
            assertThat(naming.toElixirName("getX")).isEqualTo("get_x");
            assertThat(naming.toElixirName("value1Count")).isEqualTo("value1_count");
        }

        @Test
        @DisplayName("连续大写视为一个缩写")
        void testAcronyms() {
            assertThat(naming.toElixirName("HTTPServer")).isEqualTo("http_server");
            assertThat(naming.toElixirName("XMLHttpRequest")).isEqualTo("xml_http_request");
            assertThat(naming.toElixirName("PI")).isEqualTo("pi");
        }

        @Test
        @DisplayName("保留前导下划线")
        void testLeadingUnderscore() {
            assertThat(naming.toElixirName("_unused")).isEqualTo("_unused");
            assertThat(naming.toElixirName("__tmp")).isEqualTo("__tmp");
        }

        @Test
        @DisplayName("已是 snake_case 的名字不变")
        void testAlreadySnake() {
            assertThat(naming.toElixirName("user_name")).isEqualTo("user_name");
        }

        @Test
        @DisplayName("保留字追加下划线")
        void testReserved() {
            assertThat(naming.toElixirName("end")).isEqualTo("end_");
            assertThat(naming.toElixirName("when")).isEqualTo("when_");
            assertThat(ElixirNaming.isReserved("fn")).isTrue();
            assertThat(ElixirNaming.isReserved("value")).isFalse();
        }

        @Test
        @DisplayName("空名字、非法字符和数字开头")
        void testEdgeCases() {
            assertThat(naming.toElixirName("")).isEqualTo("_");
            assertThat(naming.toElixirName(null)).isEqualTo("_");
            assertThat(naming.toElixirName("a-b")).isEqualTo("a_b");
            assertThat(naming.toElixirName("2fast")).isEqualTo("_2fast");
        }
    }

    // ============ 模块名 ============

    @Nested
    @DisplayName("模块名")
    class Modules {

        @Test
        @DisplayName("包路径每段首字母大写")
        void testModuleName() {
            assertThat(naming.toModuleName("my.pkg.Thing")).isEqualTo("My.Pkg.Thing");
            assertThat(naming.toModuleName("Point")).isEqualTo("Point");
        }

        @Test
        @DisplayName("跳过空段")
        void testEmptySegments() {
            assertThat(naming.toModuleName("a..b")).isEqualTo("A.B");
        }
    }
}
