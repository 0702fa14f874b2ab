package com.openforge.storyagent.image;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Blocking client for an OpenAI-compatible /images/generations endpoint.
 *
 * Every call goes through the "imageGeneration" circuit breaker and retry,
 * the endpoint is shared and rate-limited across all sessions.
 *
 * Result handling:
 *   url      — returned as-is
 *   b64_json — decoded and written to the output directory; the file path
 *              is returned
 */
@Slf4j
@Component
@EnableConfigurationProperties(ImageGenerationProperties.class)
public class ImageGenerationClient {

    private final HttpClient                httpClient;
    private final ObjectMapper              objectMapper;
    private final ImageGenerationProperties config;
    private final CircuitBreaker            circuitBreaker;
    private final Retry                     retry;

    public ImageGenerationClient(HttpClient httpClient,
                                 ObjectMapper objectMapper,
                                 ImageGenerationProperties config,
                                 CircuitBreaker imageGenerationCircuitBreaker,
                                 Retry imageGenerationRetry) {
        this.httpClient     = httpClient;
        this.objectMapper   = objectMapper;
        this.config         = config;
        this.circuitBreaker = imageGenerationCircuitBreaker;
        this.retry          = imageGenerationRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Generates one image for the prompt.
     *
     * @return a URL or a local file path
     * @throws ImageGenerationException when the provider ultimately fails
     */
    public String generate(String prompt) {
        if (config.baseUrl() == null || config.baseUrl().isBlank()) {
            throw new ImageGenerationException("No image generation endpoint configured (agent.image.base-url)");
        }
        Supplier<String> decorated = CircuitBreaker.decorateSupplier(circuitBreaker,
                Retry.decorateSupplier(retry, () -> requestImage(prompt)));
        try {
            return decorated.get();
        } catch (ImageGenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new ImageGenerationException(
                    "Image provider [%s] ultimately failed: %s".formatted(config.name(), e.getMessage()), e);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private String requestImage(String prompt) {
        String body = serialize(ImageRequest.single(config.model(), prompt, config.size()));
        log.debug("[ImageClient:{}] → POST body-length={}", config.name(), body.length());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/images/generations"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ImageGenerationException("Network error calling image provider [%s]"
                    .formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageGenerationException("Interrupted while calling image provider [%s]"
                    .formatted(config.name()), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ImageGenerationException("Image provider [%s] returned HTTP %d: %s"
                    .formatted(config.name(), status, response.body()));
        }
        return toReference(parse(response.body()));
    }

    private ImageResponse parse(String body) {
        try {
            return objectMapper.readValue(body, ImageResponse.class);
        } catch (JsonProcessingException e) {
            throw new ImageGenerationException(
                    "Failed to parse response from image provider [%s]".formatted(config.name()), e);
        }
    }

    private String toReference(ImageResponse response) {
        if (response.data() == null || response.data().isEmpty()) {
            throw new ImageGenerationException("Image provider [%s] returned no images".formatted(config.name()));
        }
        ImageResponse.ImageData image = response.data().get(0);
        if (image.url() != null && !image.url().isBlank()) {
            return image.url();
        }
        if (image.b64Json() != null && !image.b64Json().isBlank()) {
            return writeImage(Base64.getDecoder().decode(image.b64Json()));
        }
        throw new ImageGenerationException("Image provider [%s] returned neither url nor b64_json"
                .formatted(config.name()));
    }

    private String writeImage(byte[] bytes) {
        try {
            Path directory = Path.of(config.outputDirectory());
            Files.createDirectories(directory);
            Path file = directory.resolve(UUID.randomUUID() + ".png");
            Files.write(file, bytes);
            log.debug("[ImageClient:{}] Wrote {} bytes to {}", config.name(), bytes.length, file);
            return file.toString();
        } catch (IOException e) {
            throw new ImageGenerationException("Failed to write generated image", e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ImageGenerationException("Failed to serialize image request", e);
        }
    }

    // ── Exception type ───────────────────────────────────────────────────────

    public static class ImageGenerationException extends RuntimeException {
        public ImageGenerationException(String message) { super(message); }
        public ImageGenerationException(String message, Throwable cause) { super(message, cause); }
    }
}
