package com.exforge.ir.pass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * pass 开关配置。未出现的 pass 默认启用。
 */
public class PassConfig {

    private final Map<String, Boolean> overrides = new LinkedHashMap<>();

    public static PassConfig defaults() {
        return new PassConfig();
    }

    public PassConfig disable(String passName) {
        overrides.put(passName, Boolean.FALSE);
        return this;
    }

    public PassConfig enable(String passName) {
        overrides.put(passName, Boolean.TRUE);
        return this;
    }

    public PassConfig set(String passName, boolean enabled) {
        overrides.put(passName, enabled);
        return this;
    }

    public boolean isEnabled(String passName) {
        Boolean value = overrides.get(passName);
        return value == null || value;
    }

    public Map<String, Boolean> getOverrides() {
        return Collections.unmodifiableMap(overrides);
    }
}
