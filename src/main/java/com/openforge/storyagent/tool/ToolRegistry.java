package com.openforge.storyagent.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps tool names to their descriptors.
 *
 * Spring injects every {@link StoryTool} bean; further tools can be added
 * programmatically. Names are unique: registering a second tool under an
 * existing name is rejected. Iteration order is registration order, which
 * is also the order tools are listed in the prompt.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, ToolDescriptor> tools = new LinkedHashMap<>();

    public ToolRegistry(List<StoryTool> storyTools) {
        storyTools.forEach(tool -> register(tool.descriptor()));
        log.info("[ToolRegistry] {} tool(s) registered: {}", tools.size(), tools.keySet());
    }

    public synchronized void register(ToolDescriptor descriptor) {
        if (tools.containsKey(descriptor.name())) {
            throw new IllegalArgumentException("Tool already registered: " + descriptor.name());
        }
        tools.put(descriptor.name(), descriptor);
        log.debug("[ToolRegistry] Registered tool [{}] with {} parameter(s)",
                descriptor.name(), descriptor.parameters().size());
    }

    public synchronized Optional<ToolDescriptor> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized List<ToolDescriptor> descriptors() {
        return List.copyOf(tools.values());
    }

    public synchronized List<String> names() {
        return new ArrayList<>(tools.keySet());
    }

    public synchronized int size() {
        return tools.size();
    }
}
