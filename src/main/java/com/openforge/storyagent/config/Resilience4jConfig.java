package com.openforge.storyagent.config;

import com.openforge.storyagent.image.ImageGenerationClient;
import com.openforge.storyagent.llm.LlmClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Programmatic Resilience4j wiring.
 *
 * Named instances:
 *   • "primaryLlm"      — the story model
 *   • "fallbackLlm"     — used when the primary circuit is OPEN or the call fails
 *   • "imageGeneration" — the shared image endpoint
 *
 * LLM retries only cover rate limiting, which is rejected before any token
 * is streamed. A retry after tokens went out would repeat them.
 *
 * A stream stopped by its own session (close, reset, timeout) ends in a
 * CancellationException, which the breakers neither record as a failure
 * nor as a success.
 */
@Configuration
public class Resilience4jConfig {

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // a story reply streams for a while; only very slow calls count
                .slowCallDurationThreshold(Duration.ofSeconds(90))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(IOException.class, RuntimeException.class)
                .ignoreExceptions(CancellationException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker("primaryLlm");
        registry.circuitBreaker("fallbackLlm");
        registry.circuitBreaker("imageGeneration");
        return registry;
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("primaryLlm");
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("fallbackLlm");
    }

    @Bean
    public CircuitBreaker imageGenerationCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("imageGeneration");
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig llmConfig = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(1))
                .retryExceptions(IOException.class, LlmClient.LlmRateLimitException.class)
                .build();

        // image requests are not streamed, so any provider failure can be repeated
        RetryConfig imageConfig = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(2))
                .retryExceptions(IOException.class, ImageGenerationClient.ImageGenerationException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(llmConfig);
        registry.retry("primaryLlm");
        registry.retry("fallbackLlm");
        registry.retry("imageGeneration", imageConfig);
        return registry;
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry("primaryLlm");
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry("fallbackLlm");
    }

    @Bean
    public Retry imageGenerationRetry(RetryRegistry registry) {
        return registry.retry("imageGeneration");
    }
}
