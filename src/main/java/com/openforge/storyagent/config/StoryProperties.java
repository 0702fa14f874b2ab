package com.openforge.storyagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Story session and tool-call protocol settings, read from application.yml
 * under the "story" prefix:
 *
 * story:
 *   max-scenes: 4
 *   start-marker: "<|startofthink|>"
 *   end-marker: "<|endofthink|>"
 *   stop-marker: "<|user|>"
 *   greeting: Hello! I'm your StoryAgent...
 *   example-images: [img_example/1.png, img_example/2.png]
 *   frame-timeout-seconds: 120
 *   memory-window: 20
 */
@ConfigurationProperties(prefix = "story")
public record StoryProperties(
        @DefaultValue("4")                 int          maxScenes,
        @DefaultValue("<|startofthink|>")  String       startMarker,
        @DefaultValue("<|endofthink|>")    String       endMarker,
        @DefaultValue("<|user|>")          String       stopMarker,
        String                                          greeting,
        @DefaultValue                      List<String> exampleImages,
        @DefaultValue("120")               int          frameTimeoutSeconds,
        @DefaultValue("20")                int          memoryWindow
) {}
