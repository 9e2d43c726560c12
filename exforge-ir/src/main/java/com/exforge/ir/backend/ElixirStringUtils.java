package com.exforge.ir.backend;

import java.util.regex.Pattern;

/**
 * Elixir 字符串与原子的转义工具
 */
public final class ElixirStringUtils {

    /** 不加引号即可书写的原子/关键字键 */
    private static final Pattern BARE_ATOM = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*[!?]?$");

    private ElixirStringUtils() {}

    /** 转义字符串内容（用于双引号包裹的字符串），只处理反斜杠、双引号、换行、回车和制表符 */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String quote(String s) {
        return "\"" + escapeString(s) + "\"";
    }

    public static boolean isBareAtom(String name) {
        return name != null && BARE_ATOM.matcher(name).matches();
    }

    /** :name 或 :"name" */
    public static String atom(String name) {
        return isBareAtom(name) ? ":" + name : ":" + quote(name);
    }

    /** 关键字键：name: 或 "name": */
    public static String keywordKey(String name) {
        return (isBareAtom(name) ? name : quote(name)) + ":";
    }
}
