package com.openforge.storyagent.image;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Image generation endpoint, read from application.yml under "agent.image":
 *
 * agent:
 *   image:
 *     name: dall-e
 *     base-url: https://api.openai.com/v1
 *     api-key: sk-...
 *     model: dall-e-3
 *     size: 1024x1024
 *     output-directory: ./tmp
 *     timeout-seconds: 180
 */
@ConfigurationProperties(prefix = "agent.image")
public record ImageGenerationProperties(
        @DefaultValue("image") String name,
        String baseUrl,
        String apiKey,
        String model,
        @DefaultValue("1024x1024") String size,
        @DefaultValue("./tmp") String outputDirectory,
        @DefaultValue("180") int timeoutSeconds
) {}
