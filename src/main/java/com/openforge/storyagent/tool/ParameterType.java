package com.openforge.storyagent.tool;

/**
 * Declared type of a tool parameter. Payload values always arrive as
 * strings; {@link #coerce} turns them into the declared Java type.
 */
public enum ParameterType {

    STRING("string") {
        @Override
        public Object coerce(String raw) {
            return raw;
        }
    },

    INTEGER("integer") {
        @Override
        public Object coerce(String raw) {
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("expected an integer but got '%s'".formatted(raw));
            }
        }
    };

    private final String schemaName;

    ParameterType(String schemaName) {
        this.schemaName = schemaName;
    }

    /** Name used when the tool list is rendered into the prompt. */
    public String schemaName() {
        return schemaName;
    }

    /**
     * @throws IllegalArgumentException when the value does not fit the type
     */
    public abstract Object coerce(String raw);
}
