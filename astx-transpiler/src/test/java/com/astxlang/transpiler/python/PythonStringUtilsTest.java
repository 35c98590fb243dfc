package com.astxlang.transpiler.python;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PythonStringUtils 测试")
class PythonStringUtilsTest {

    @Test
    @DisplayName("普通字符串原样保留")
    void testPlain() {
        assertThat(PythonStringUtils.quote("hello world")).isEqualTo("'hello world'");
        assertThat(PythonStringUtils.quote("")).isEqualTo("''");
    }

    @Test
    @DisplayName("转义引号、反斜杠和控制字符")
    void testEscapes() {
        assertThat(PythonStringUtils.escapeString("a\\b")).isEqualTo("a\\\\b");
        assertThat(PythonStringUtils.escapeString("'\"")).isEqualTo("\\'\"");
        assertThat(PythonStringUtils.escapeString("\t\r\n")).isEqualTo("\\t\\r\\n");
        assertThat(PythonStringUtils.escapeString("\u0001\u007f")).isEqualTo("\\x01\\x7f");
    }

    @Test
    @DisplayName("非 ASCII 字符不转义")
    void testUnicode() {
        assertThat(PythonStringUtils.quote("中文")).isEqualTo("'中文'");
    }
}
