package com.openforge.storyagent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storyagent.engine.SessionLoop;
import com.openforge.storyagent.engine.ToolCallExtractor;
import com.openforge.storyagent.engine.slot.SlotResultRouter;
import com.openforge.storyagent.tool.ToolInvoker;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free engine classes from the "story" settings.
 */
@Configuration
@EnableConfigurationProperties(StoryProperties.class)
public class StoryEngineConfig {

    @Bean
    public ToolCallExtractor toolCallExtractor(ObjectMapper objectMapper, StoryProperties properties) {
        return new ToolCallExtractor(objectMapper,
                properties.startMarker(), properties.endMarker(), properties.stopMarker());
    }

    @Bean
    public SessionLoop sessionLoop(ToolCallExtractor extractor, ToolInvoker invoker, SlotResultRouter router) {
        return new SessionLoop(extractor, invoker, router);
    }
}
