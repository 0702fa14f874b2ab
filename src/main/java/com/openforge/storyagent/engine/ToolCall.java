package com.openforge.storyagent.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool invocation found in the generated text.
 *
 * @param apiName     registry key of the tool
 * @param parameters  raw parameter values, in payload order
 * @param sourceSpan  the delimited substring, markers included
 */
public record ToolCall(String apiName, Map<String, String> parameters, String sourceSpan) {

    public ToolCall {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
