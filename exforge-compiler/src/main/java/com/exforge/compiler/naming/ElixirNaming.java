package com.exforge.compiler.naming;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * 默认命名规则：camelCase → snake_case，避开 Elixir 保留字。
 */
public class ElixirNaming implements IdentifierNaming {

    private static final Set<String> RESERVED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "do", "end", "fn", "nil", "true", "false", "when", "and", "or", "not",
            "in", "catch", "rescue", "after", "else", "__MODULE__", "__ENV__")));

    @Override
    public String toElixirName(String sourceName) {
        if (sourceName == null || sourceName.isEmpty()) {
            return "_";
        }
        String name = toSnakeCase(sourceName);
        if (RESERVED.contains(name)) {
            return name + "_";
        }
        return name;
    }

    @Override
    public String toModuleName(String sourcePath) {
        String[] parts = sourcePath.split("\\.");
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty()) continue;
            if (sb.length() > 0) sb.append('.');
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }

    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    /**
     * camelCase / PascalCase → snake_case。保留前导下划线，非法字符替换为下划线。
     */
    static String toSnakeCase(String name) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < name.length() && name.charAt(i) == '_') {
            sb.append('_');
            i++;
        }
        boolean prevLowerOrDigit = false;
        for (; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '_'
                        && (prevLowerOrDigit || nextLower)) {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
                prevLowerOrDigit = false;
            } else if (Character.isLetterOrDigit(c) || c == '_') {
                sb.append(c);
                prevLowerOrDigit = Character.isLowerCase(c) || Character.isDigit(c);
            } else {
                sb.append('_');
                prevLowerOrDigit = false;
            }
        }
        if (sb.length() > 0 && Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }
}
