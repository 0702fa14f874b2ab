package com.openforge.storyagent.tool.builtin;

import com.openforge.storyagent.config.StoryProperties;
import com.openforge.storyagent.engine.slot.SlotUpdate;
import com.openforge.storyagent.tool.StoryTool;
import com.openforge.storyagent.tool.ToolDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills the first image slots with the configured example illustrations so
 * the user can pick a drawing style.
 */
@Component
public class ShowExampleTool implements StoryTool {

    public static final String NAME = "show_image_example";

    private final ToolDescriptor descriptor;

    public ShowExampleTool(StoryProperties properties) {
        List<String> examples = List.copyOf(properties.exampleImages());
        this.descriptor = ToolDescriptor.builder()
                .name(NAME)
                .description("Show example illustrations in different drawing styles before asking the user which style they prefer.")
                .capability(arguments -> examples)
                .resultContract((arguments, result) -> {
                    List<SlotUpdate> updates = new ArrayList<>();
                    List<?> images = (List<?>) result;
                    for (int i = 0; i < images.size(); i++) {
                        updates.add(SlotUpdate.image(i, images.get(i).toString()));
                    }
                    return updates;
                })
                .build();
    }

    @Override
    public ToolDescriptor descriptor() {
        return descriptor;
    }
}
