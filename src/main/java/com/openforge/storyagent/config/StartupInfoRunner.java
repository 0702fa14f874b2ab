package com.openforge.storyagent.config;

import com.openforge.storyagent.image.ImageGenerationProperties;
import com.openforge.storyagent.llm.LlmProperties;
import com.openforge.storyagent.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready:
 * server port, LLM providers and image endpoint (keys masked), protocol markers
 * and the registered story tools.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final LlmProperties             llmProperties;
    private final ImageGenerationProperties imageProperties;
    private final StoryProperties           storyProperties;
    private final ToolRegistry              toolRegistry;
    private final Environment               env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║             StoryAgent  —  Startup Summary               ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}  [{}]  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Image Generation                                        ║
                ║    Provider       : {}  [{}]  key={}
                ║    Output Dir     : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Story Engine                                            ║
                ║    Scenes         : {}
                ║    Markers        : {} … {}  stop={}
                ║    Tools          : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                providerName(llmProperties.primary()),
                providerModel(llmProperties.primary()),
                maskKey(llmProperties.primary() == null ? null : llmProperties.primary().apiKey()),

                providerName(llmProperties.fallback()),
                providerModel(llmProperties.fallback()),
                maskKey(llmProperties.fallback() == null ? null : llmProperties.fallback().apiKey()),

                imageProperties.name(),
                imageProperties.model(),
                maskKey(imageProperties.apiKey()),
                imageProperties.outputDirectory(),

                storyProperties.maxScenes(),
                storyProperties.startMarker(), storyProperties.endMarker(), storyProperties.stopMarker(),
                toolRegistry.names()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String providerName(LlmProperties.ProviderConfig config) {
        return config == null ? "(not configured)" : config.name();
    }

    private static String providerModel(LlmProperties.ProviderConfig config) {
        return config == null ? "-" : config.model();
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
