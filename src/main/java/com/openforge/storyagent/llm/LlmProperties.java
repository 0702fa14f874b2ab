package com.openforge.storyagent.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Language-model providers, read from application.yml under "agent.llm":
 *
 * agent:
 *   llm:
 *     primary:
 *       name: qwen
 *       base-url: https://dashscope.aliyuncs.com/compatible-mode/v1
 *       api-key: sk-...
 *       model: qwen-max
 *       timeout-seconds: 120
 *     fallback:
 *       name: deepseek-chat
 *       base-url: https://api.deepseek.com/v1
 *       api-key: sk-...
 *       model: deepseek-chat
 *       timeout-seconds: 120
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120") int timeoutSeconds
    ) {}
}
