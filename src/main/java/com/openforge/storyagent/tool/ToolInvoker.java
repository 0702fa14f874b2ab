package com.openforge.storyagent.tool;

import com.openforge.storyagent.engine.ErrorKind;
import com.openforge.storyagent.engine.ToolCall;
import com.openforge.storyagent.engine.slot.SlotUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a {@link ToolCall} against the registry and runs it.
 *
 * Never throws: an unknown name, a missing or ill-typed parameter and any
 * exception from the tool itself all come back as a
 * {@link ToolOutcome.Failure}, so one bad call cannot abort a turn.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolInvoker {

    private static final int MAX_REASON_LENGTH = 200;

    private final ToolRegistry registry;

    public ToolOutcome invoke(ToolCall call) {
        String name = call.apiName();
        ToolDescriptor descriptor = registry.find(name).orElse(null);
        if (descriptor == null) {
            log.warn("[Invoker] Unknown tool: {}", name);
            return ToolOutcome.failure(ErrorKind.UNKNOWN_TOOL, name,
                    "unknown tool, available tools are " + registry.names());
        }

        // ── Validate & coerce ────────────────────────────────────────────────
        Map<String, Object> coerced = new LinkedHashMap<>(call.parameters());
        for (ToolParameter parameter : descriptor.parameters()) {
            String raw = call.parameters().get(parameter.name());
            if (raw == null || raw.isBlank()) {
                coerced.remove(parameter.name());
                if (parameter.required()) {
                    log.warn("[Invoker] {} is missing required parameter '{}'", name, parameter.name());
                    return ToolOutcome.failure(ErrorKind.MISSING_PARAMETER, name,
                            "missing required parameter '%s'".formatted(parameter.name()));
                }
                continue;
            }
            try {
                coerced.put(parameter.name(), parameter.type().coerce(raw));
            } catch (IllegalArgumentException e) {
                log.warn("[Invoker] {} parameter '{}' has the wrong type: {}", name, parameter.name(), raw);
                return ToolOutcome.failure(ErrorKind.BAD_PARAMETER_TYPE, name,
                        "parameter '%s' %s".formatted(parameter.name(), e.getMessage()));
            }
        }
        ToolArguments arguments = new ToolArguments(coerced);

        // ── Execute ──────────────────────────────────────────────────────────
        try {
            Object result = descriptor.capability().invoke(arguments);
            List<SlotUpdate> updates = descriptor.resultContract().toSlotUpdates(arguments, result);
            log.info("[Invoker] {} succeeded with {} slot update(s)", name, updates.size());
            return ToolOutcome.success(name, updates);
        } catch (Exception e) {
            log.warn("[Invoker] {} threw {}: {}", name, e.getClass().getSimpleName(), e.getMessage(), e);
            return ToolOutcome.failure(ErrorKind.TOOL_EXECUTION_ERROR, name, shortDiagnostic(e));
        }
    }

    private static String shortDiagnostic(Exception e) {
        String message = e.getMessage();
        String text = message == null || message.isBlank()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + message;
        return text.length() <= MAX_REASON_LENGTH ? text : text.substring(0, MAX_REASON_LENGTH) + "...";
    }
}
