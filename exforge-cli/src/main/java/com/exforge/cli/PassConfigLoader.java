package com.exforge.cli;

import com.exforge.ir.backend.PrintConfig;
import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassConfig;
import com.exforge.ir.pass.PassPipeline;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 读取 JSON 配置：
 * <pre>
 * {"passes": {"pipe-idioms": false}, "indentSize": 2}
 * </pre>
 * 两个字段都可省略；未知的 pass 名视为配置错误。
 */
public class PassConfigLoader {

    public CompilerSettings load(Path file) throws IOException {
        String json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return parse(json);
    }

    public CompilerSettings parse(String json) {
        JsonObject root;
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                throw new IllegalArgumentException("configuration must be a JSON object");
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("malformed configuration: " + e.getMessage(), e);
        }

        PassConfig passes = PassConfig.defaults();
        if (root.has("passes")) {
            if (!root.get("passes").isJsonObject()) {
                throw new IllegalArgumentException("'passes' must be an object of pass name to boolean");
            }
            Set<String> known = knownPasses();
            for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject("passes").entrySet()) {
                requireKnown(entry.getKey(), known);
                if (!isPrimitive(entry.getValue()) || !entry.getValue().getAsJsonPrimitive().isBoolean()) {
                    throw new IllegalArgumentException("pass '" + entry.getKey() + "' must be true or false");
                }
                passes.set(entry.getKey(), entry.getValue().getAsBoolean());
            }
        }
        PrintConfig print = new PrintConfig();
        if (root.has("indentSize")) {
            JsonElement indent = root.get("indentSize");
            if (!isPrimitive(indent) || !indent.getAsJsonPrimitive().isNumber()) {
                throw new IllegalArgumentException("'indentSize' must be a number");
            }
            print.setIndentSize(indent.getAsInt());
        }
        return new CompilerSettings(passes, print);
    }

    private static boolean isPrimitive(JsonElement element) {
        return element != null && element.isJsonPrimitive();
    }

    /** 默认流水线中的 pass 名 */
    static Set<String> knownPasses() {
        Set<String> names = new LinkedHashSet<>();
        for (ElixirPass pass : PassPipeline.createDefault().getPasses()) names.add(pass.getName());
        return names;
    }

    static void requireKnown(String passName, Set<String> known) {
        if (!known.contains(passName)) {
            throw new IllegalArgumentException("unknown pass '" + passName + "' (known: " + known + ")");
        }
    }
}
