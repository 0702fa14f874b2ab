package com.openforge.storyagent.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.storyagent.llm.model.ChatRequest;
import com.openforge.storyagent.llm.model.ChatResponse;
import com.openforge.storyagent.llm.model.Message;
import com.openforge.storyagent.llm.model.StreamingChunk;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Stateless streaming client for an OpenAI-compatible /chat/completions
 * endpoint.
 *
 * {@link #streamChat} calls the token callback synchronously for every
 * content token and returns the assembled response once the stream ends.
 * Tool calls are not part of the wire protocol here: the model writes them
 * into its text between delimiters, and the engine picks them out.
 */
@Slf4j
public class LlmClient {

    private static final String SSE_DATA_PREFIX = "data: ";
    private static final String SSE_DONE        = "data: [DONE]";

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Streaming chat completion via SSE.
     *
     * @param request       ChatRequest (stream flag is forced to true internally)
     * @param tokenCallback invoked with each non-empty content token
     * @return assembled ChatResponse with the complete message
     */
    public ChatResponse streamChat(ChatRequest request, Consumer<String> tokenCallback) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()));
        }

        // fall back to the provider's default model when the caller left it empty
        ChatRequest effectiveRequest = request;
        if (request.model() == null || request.model().isBlank()) {
            effectiveRequest = request.toBuilder().model(config.model()).build();
        }

        String requestBody = serializeWithStream(effectiveRequest);
        log.debug("[LlmClient:{}] → streamChat POST body-length={}", config.name(), requestBody.length());

        HttpResponse<Stream<String>> httpResponse;
        try {
            httpResponse = httpClient.send(
                    buildHttpRequest(requestBody),
                    HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new LlmException("Network error (streaming) calling provider [%s]"
                    .formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]"
                    .formatted(config.name()), e);
        }

        int status = httpResponse.statusCode();
        if (status == 429) {
            throw new LlmRateLimitException(
                    "Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            // OpenAI-compatible providers put the error in the body; keep the first lines
            String bodySnippet = "";
            Stream<String> lines = httpResponse.body();
            if (lines != null) {
                bodySnippet = lines.limit(20).reduce(
                        new StringBuilder(),
                        (sb, line) -> {
                            if (sb.length() > 0) sb.append('\n');
                            if (sb.length() < 2048) {
                                sb.append(line);
                            }
                            return sb;
                        },
                        StringBuilder::append
                ).toString();
            }
            throw new LlmException(
                    "Provider [%s] returned HTTP %d on stream open: %s"
                            .formatted(config.name(), status, bodySnippet));
        }

        return assembleStreamingResponse(httpResponse.body(), tokenCallback);
    }

    /** The model name configured for this provider (e.g. "qwen-max"). */
    public String modelName() {
        return config.model();
    }

    // ── Streaming assembly ───────────────────────────────────────────────────

    /**
     * Reads the SSE line stream, calls tokenCallback for content deltas and
     * assembles a ChatResponse that mirrors the non-streaming format.
     */
    ChatResponse assembleStreamingResponse(Stream<String> lines,
                                           Consumer<String> tokenCallback) {
        StringBuilder contentBuilder = new StringBuilder();
        String responseId    = null;
        String responseModel = null;
        String finishReason  = null;

        for (String line : (Iterable<String>) lines::iterator) {
            if (line.isEmpty() || !line.startsWith(SSE_DATA_PREFIX)) continue;
            if (SSE_DONE.equals(line)) break;

            String json = line.substring(SSE_DATA_PREFIX.length());
            StreamingChunk chunk;
            try {
                chunk = objectMapper.readValue(json, StreamingChunk.class);
            } catch (JsonProcessingException e) {
                log.warn("[LlmClient:{}] Failed to parse SSE chunk: {}", config.name(), json);
                continue;
            }

            if (responseId == null)    responseId    = chunk.id();
            if (responseModel == null) responseModel = chunk.model();

            if (chunk.choices() == null || chunk.choices().isEmpty()) continue;

            StreamingChunk.ChunkChoice choice = chunk.choices().get(0);
            if (choice.finishReason() != null) finishReason = choice.finishReason();

            StreamingChunk.DeltaMessage delta = choice.delta();
            if (delta != null && delta.content() != null && !delta.content().isEmpty()) {
                contentBuilder.append(delta.content());
                tokenCallback.accept(delta.content());
            }
        }

        log.debug("[LlmClient:{}] ← stream ended finish_reason={} content-length={}",
                config.name(), finishReason, contentBuilder.length());
        ChatResponse.Choice choice = new ChatResponse.Choice(0,
                Message.assistant(contentBuilder.toString()), finishReason);
        return new ChatResponse(responseId, responseModel, List.of(choice));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                // streaming responses can take a long time to complete
                .timeout(Duration.ofSeconds(config.timeoutSeconds() * 2L))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    /** Serializes a ChatRequest with "stream": true injected into the JSON. */
    private String serializeWithStream(ChatRequest request) {
        try {
            ObjectNode node = objectMapper.valueToTree(request);
            node.put("stream", true);
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize streaming request", e);
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
