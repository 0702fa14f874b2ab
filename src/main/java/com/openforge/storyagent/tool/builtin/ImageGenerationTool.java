package com.openforge.storyagent.tool.builtin;

import com.openforge.storyagent.engine.slot.SlotUpdate;
import com.openforge.storyagent.image.ImageGenerationClient;
import com.openforge.storyagent.tool.ParameterType;
import com.openforge.storyagent.tool.StoryTool;
import com.openforge.storyagent.tool.ToolArguments;
import com.openforge.storyagent.tool.ToolDescriptor;
import com.openforge.storyagent.tool.ToolParameter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Illustrates one scene. The image lands in {@code image[idx]} and the scene
 * text in {@code caption[idx]}.
 */
@Slf4j
@Component
public class ImageGenerationTool implements StoryTool {

    public static final String NAME = "image_generation";

    private final ImageGenerationClient client;
    private final ToolDescriptor        descriptor;

    public ImageGenerationTool(ImageGenerationClient client) {
        this.client = client;
        this.descriptor = ToolDescriptor.builder()
                .name(NAME)
                .description("Generate an illustration for one scene of the story.")
                .parameter(ToolParameter.required("text", ParameterType.STRING, "The scene text to illustrate"))
                .parameter(ToolParameter.required("idx", ParameterType.INTEGER, "Zero-based scene index"))
                .parameter(ToolParameter.optional("type", ParameterType.STRING, "Drawing style, e.g. cartoon or cyberpunk"))
                .capability(this::generate)
                .resultContract((arguments, result) -> {
                    int idx = arguments.getInt("idx");
                    return List.of(
                            SlotUpdate.image(idx, result.toString()),
                            SlotUpdate.caption(idx, arguments.getString("text")));
                })
                .build();
    }

    @Override
    public ToolDescriptor descriptor() {
        return descriptor;
    }

    private Object generate(ToolArguments arguments) {
        String style  = arguments.getString("type", "");
        String prompt = style.isBlank()
                ? arguments.getString("text")
                : "%s, in %s style".formatted(arguments.getString("text"), style);
        log.debug("[ImageTool] Scene {} prompt-length={}", arguments.getInt("idx"), prompt.length());
        return client.generate(prompt);
    }
}
