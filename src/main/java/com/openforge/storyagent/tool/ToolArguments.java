package com.openforge.storyagent.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated, type-coerced parameters handed to a tool capability.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ToolArguments empty() {
        return new ToolArguments(Map.of());
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public String getString(String name) {
        Object value = require(name);
        return value.toString();
    }

    public String getString(String name, String defaultValue) {
        Object value = values.get(name);
        return value == null ? defaultValue : value.toString();
    }

    public int getInt(String name) {
        Object value = require(name);
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new IllegalStateException("argument '%s' is not numeric".formatted(name));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalStateException("argument '%s' is not present".formatted(name));
        }
        return value;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
