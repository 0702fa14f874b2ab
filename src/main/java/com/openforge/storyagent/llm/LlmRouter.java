package com.openforge.storyagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storyagent.llm.model.ChatRequest;
import com.openforge.storyagent.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Primary → fallback routing for the story model.
 *
 *   streamChat(request, tokenCallback)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryLlmClient.streamChat(request)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallbackLlmClient.streamChat(request)
 *
 * If the primary drops mid-stream the callback has already seen part of the
 * reply. Callers that accumulate tokens must start over when
 * {@code onRestart} fires before the fallback begins streaming.
 *
 * A {@link CancellationException} thrown from the token callback means the
 * caller stopped listening. It propagates as-is and never engages the
 * fallback.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this(new LlmClient(httpClient, objectMapper, properties.primary()),
                new LlmClient(httpClient, objectMapper, properties.fallback()),
                primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker,
                primaryLlmRetry, fallbackLlmRetry);
    }

    LlmRouter(LlmClient primaryClient,
              LlmClient fallbackClient,
              CircuitBreaker primaryCb,
              CircuitBreaker fallbackCb,
              Retry primaryRetry,
              Retry fallbackRetry) {
        this.primaryClient  = primaryClient;
        this.fallbackClient = fallbackClient;
        this.primaryCb      = primaryCb;
        this.fallbackCb     = fallbackCb;
        this.primaryRetry   = primaryRetry;
        this.fallbackRetry  = fallbackRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @param request        standard ChatRequest (stream flag injected internally)
     * @param tokenCallback  called once per content token on the calling thread
     * @param onRestart      called before the fallback provider starts streaming
     * @return fully assembled ChatResponse after the stream ends
     */
    public ChatResponse streamChat(ChatRequest request,
                                   Consumer<String> tokenCallback,
                                   Runnable onRestart) {
        try {
            ChatRequest primaryRequest = overrideModel(request, primaryClient.modelName());
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.streamChat(primaryRequest, tokenCallback), "primary");
        } catch (CancellationException cancelled) {
            throw cancelled;
        } catch (Exception primaryException) {
            log.warn("[LlmRouter] Primary stream failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            onRestart.run();
            ChatRequest fallbackRequest = overrideModel(request, fallbackClient.modelName());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.streamChat(fallbackRequest, tokenCallback), "fallback");
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               String label) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (CancellationException e) {
            throw e;
        } catch (Exception e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }

    private ChatRequest overrideModel(ChatRequest original, String modelName) {
        return original.toBuilder().model(modelName).build();
    }
}
