package com.openforge.storyagent.tool;

/**
 * A tool contributed as a Spring bean. {@link ToolRegistry} collects every
 * implementation at startup.
 */
public interface StoryTool {

    ToolDescriptor descriptor();
}
