package com.openforge.storyagent.tool;

/**
 * One entry of a tool's parameter schema.
 */
public record ToolParameter(
        String        name,
        String        description,
        ParameterType type,
        boolean       required
) {

    public static ToolParameter required(String name, ParameterType type, String description) {
        return new ToolParameter(name, description, type, true);
    }

    public static ToolParameter optional(String name, ParameterType type, String description) {
        return new ToolParameter(name, description, type, false);
    }
}
