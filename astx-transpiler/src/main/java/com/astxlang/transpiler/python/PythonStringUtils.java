package com.astxlang.transpiler.python;

/**
 * Python 字符串字面量转义
 */
public final class PythonStringUtils {

    private PythonStringUtils() {}

    /** 单引号包裹的字符串字面量 */
    public static String quote(String s) {
        return "'" + escapeString(s) + "'";
    }

    /** 转义字符串内容（用于单引号包裹的字符串） */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\'': sb.append("\\'"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }
}
