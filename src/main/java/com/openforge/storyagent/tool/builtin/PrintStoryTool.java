package com.openforge.storyagent.tool.builtin;

import com.openforge.storyagent.engine.slot.SlotUpdate;
import com.openforge.storyagent.tool.ParameterType;
import com.openforge.storyagent.tool.StoryTool;
import com.openforge.storyagent.tool.ToolDescriptor;
import com.openforge.storyagent.tool.ToolParameter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Shows the finished story in the story panel.
 */
@Component
public class PrintStoryTool implements StoryTool {

    public static final String NAME = "print_story_tool";

    private final ToolDescriptor descriptor = ToolDescriptor.builder()
            .name(NAME)
            .description("Display the complete story text in the story panel once the user has approved it.")
            .parameter(ToolParameter.required("story", ParameterType.STRING, "The full story text"))
            .capability(arguments -> arguments.getString("story").strip())
            .resultContract((arguments, result) -> List.of(SlotUpdate.story(result.toString())))
            .build();

    @Override
    public ToolDescriptor descriptor() {
        return descriptor;
    }
}
