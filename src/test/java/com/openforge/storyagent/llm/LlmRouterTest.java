package com.openforge.storyagent.llm;

import com.openforge.storyagent.config.Resilience4jConfig;
import com.openforge.storyagent.llm.model.ChatRequest;
import com.openforge.storyagent.llm.model.ChatResponse;
import com.openforge.storyagent.llm.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmRouterTest {

    private LlmClient primary;
    private LlmClient fallback;
    private LlmRouter router;
    private AtomicInteger restarts;

    @BeforeEach
    void setUp() {
        primary = mock(LlmClient.class);
        fallback = mock(LlmClient.class);
        when(primary.modelName()).thenReturn("primary-model");
        when(fallback.modelName()).thenReturn("fallback-model");
        RetryConfig once = RetryConfig.custom().maxAttempts(1).build();
        router = new LlmRouter(primary, fallback,
                CircuitBreaker.ofDefaults("primary"), CircuitBreaker.ofDefaults("fallback"),
                Retry.of("primary", once), Retry.of("fallback", once));
        restarts = new AtomicInteger();
    }

    private static ChatResponse response(String content) {
        return new ChatResponse("id", "m", List.of(new ChatResponse.Choice(0, Message.assistant(content), "stop")));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldUsePrimaryWithItsModel() {
        when(primary.streamChat(any(ChatRequest.class), any(Consumer.class))).thenReturn(response("hi"));

        ChatResponse response = router.streamChat(ChatRequest.story(List.of(), "<|user|>"), token -> { },
                restarts::incrementAndGet);

        assertEquals("hi", response.content());
        assertEquals(0, restarts.get());
        verify(primary).streamChat(argThat(request -> "primary-model".equals(request.model())), any(Consumer.class));
        verify(fallback, never()).streamChat(any(ChatRequest.class), any(Consumer.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRestartOnFallbackWhenPrimaryFails() {
        when(primary.streamChat(any(ChatRequest.class), any(Consumer.class)))
                .thenThrow(new LlmClient.LlmException("HTTP 500"));
        when(fallback.streamChat(any(ChatRequest.class), any(Consumer.class))).thenReturn(response("from fallback"));

        ChatResponse response = router.streamChat(ChatRequest.story(List.of(), null), token -> { },
                restarts::incrementAndGet);

        assertEquals("from fallback", response.content());
        assertEquals(1, restarts.get());
        verify(fallback).streamChat(argThat(request -> "fallback-model".equals(request.model())), any(Consumer.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldFailWhenBothProvidersFail() {
        when(primary.streamChat(any(ChatRequest.class), any(Consumer.class)))
                .thenThrow(new LlmClient.LlmException("primary down"));
        when(fallback.streamChat(any(ChatRequest.class), any(Consumer.class)))
                .thenThrow(new LlmClient.LlmException("fallback down"));

        LlmClient.LlmException error = assertThrows(LlmClient.LlmException.class,
                () -> router.streamChat(ChatRequest.story(List.of(), null), token -> { }, restarts::incrementAndGet));

        assertTrue(error.getMessage().contains("fallback provider ultimately failed"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldNotCountCancelledStreamsAgainstPrimary() {
        Resilience4jConfig config = new Resilience4jConfig();
        CircuitBreakerRegistry breakers = config.circuitBreakerRegistry();
        RetryRegistry retries = config.retryRegistry();
        CircuitBreaker primaryCb = config.primaryLlmCircuitBreaker(breakers);
        LlmRouter configured = new LlmRouter(primary, fallback,
                primaryCb, config.fallbackLlmCircuitBreaker(breakers),
                config.primaryLlmRetry(retries), config.fallbackLlmRetry(retries));
        when(primary.streamChat(any(ChatRequest.class), any(Consumer.class)))
                .thenThrow(new CancellationException("frame source closed"));

        for (int i = 0; i < 6; i++) {
            assertThrows(CancellationException.class, () -> configured.streamChat(
                    ChatRequest.story(List.of(), null), token -> { }, restarts::incrementAndGet));
        }

        assertEquals(0, primaryCb.getMetrics().getNumberOfFailedCalls());
        assertEquals(CircuitBreaker.State.CLOSED, primaryCb.getState());
        assertEquals(0, restarts.get());
        verify(fallback, never()).streamChat(any(ChatRequest.class), any(Consumer.class));
    }
}
