package com.openforge.storyagent.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Streaming parser for delimited tool-call blocks.
 *
 * Wire format, as the model is instructed to write it:
 *
 *   <|startofthink|>```JSON
 *   {"api_name": "image_generation", "parameters": {"text": "...", "idx": "0", "type": "cartoon"}}
 *   ```<|endofthink|>
 *
 * The extractor is stateless and always scans the whole cumulative frame
 * text, so a block split across two frames is reported only once the frame
 * holding its end marker arrives.
 *
 * Residual rules:
 *   - every complete block (valid or not) is replaced by a single space
 *   - a start marker without an end marker cuts the residual at that marker
 *   - text from the stop marker onward is dropped before scanning
 */
@Slf4j
public class ToolCallExtractor {

    private static final Pattern LEADING_FENCE  = Pattern.compile("^```[A-Za-z0-9_-]*\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");

    private final ObjectMapper objectMapper;
    private final String       startMarker;
    private final String       endMarker;
    private final String       stopMarker;

    /**
     * @param stopMarker optional; null or blank disables truncation
     */
    public ToolCallExtractor(ObjectMapper objectMapper,
                             String startMarker,
                             String endMarker,
                             String stopMarker) {
        if (startMarker == null || startMarker.isEmpty() || endMarker == null || endMarker.isEmpty()) {
            throw new IllegalArgumentException("start and end markers must be non-empty");
        }
        this.objectMapper = objectMapper;
        this.startMarker  = startMarker;
        this.endMarker    = endMarker;
        this.stopMarker   = stopMarker == null || stopMarker.isBlank() ? null : stopMarker;
    }

    public Extraction extract(String frameText) {
        String text = cutAtStopMarker(frameText == null ? "" : frameText);

        List<ToolCall>     calls    = new ArrayList<>();
        List<ParseFailure> failures = new ArrayList<>();
        StringBuilder      residual = new StringBuilder(text.length());

        int cursor = 0;
        while (cursor <= text.length()) {
            int start = text.indexOf(startMarker, cursor);
            if (start < 0) {
                residual.append(text, cursor, text.length());
                break;
            }
            residual.append(text, cursor, start);

            int payloadStart = start + startMarker.length();
            int end = text.indexOf(endMarker, payloadStart);
            if (end < 0) {
                // pending block: hidden until a later frame completes it
                break;
            }

            int    spanEnd = end + endMarker.length();
            String span    = text.substring(start, spanEnd);
            try {
                calls.add(parse(text.substring(payloadStart, end), span));
            } catch (MalformedCallException e) {
                log.debug("[Extractor] Dropping malformed tool-call block: {}", e.getMessage());
                failures.add(new ParseFailure(span, e.getMessage()));
            }
            residual.append(' ');
            cursor = spanEnd;
        }

        return new Extraction(calls, residual.toString(), failures);
    }

    // ── Payload parsing ──────────────────────────────────────────────────────

    private ToolCall parse(String payload, String span) throws MalformedCallException {
        String json = stripFences(payload.trim());
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedCallException("invalid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new MalformedCallException("payload is not a JSON object");
        }

        JsonNode name = root.get("api_name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw new MalformedCallException("missing string field 'api_name'");
        }
        JsonNode params = root.get("parameters");
        if (params == null || !params.isObject()) {
            throw new MalformedCallException("missing object field 'parameters'");
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = params.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) continue;
            parameters.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return new ToolCall(name.asText().trim(), parameters, span);
    }

    private static String stripFences(String payload) {
        String stripped = LEADING_FENCE.matcher(payload).replaceFirst("");
        return TRAILING_FENCE.matcher(stripped).replaceFirst("");
    }

    private String cutAtStopMarker(String text) {
        if (stopMarker == null) return text;
        int stop = text.indexOf(stopMarker);
        return stop < 0 ? text : text.substring(0, stop);
    }

    private static final class MalformedCallException extends Exception {
        MalformedCallException(String message) {
            super(message);
        }
    }
}
