package com.openforge.storyagent.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storyagent.config.StoryProperties;
import com.openforge.storyagent.engine.Exchange;
import com.openforge.storyagent.llm.model.Message;
import com.openforge.storyagent.tool.ToolDescriptor;
import com.openforge.storyagent.tool.ToolParameter;
import com.openforge.storyagent.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the message list sent to the model for one turn.
 *
 * Layout:
 *   system    — persona, call convention, tool list, worked example
 *   user/assistant pairs — the most recent exchanges of the session
 *   user      — the new message plus a reminder to answer one turn only
 *
 * Memory is trimmed to the last {@code story.memory-window} exchanges; the
 * system prompt is rebuilt every turn and never trimmed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationContextService {

    private static final String SYSTEM_TEMPLATE = """
            You are a Story Agent. Talk with the user to develop a story idea; once the idea is settled, \
            write the story for the user, then ask which drawing style they prefer, and finally illustrate \
            the story. The following tools are available in this conversation; decide on your own whether \
            the current request needs one. To call a tool, write the call as JSON with the fields api_name \
            and parameters, and put %1$s before it and %2$s after it. Then continue your reply based on the \
            result of the call.

            Tools:
            %3$s
            """;

    private static final String INSTRUCTION_TEMPLATE = """
            [Conversation example]

            Human: Write me a story about friendship and adventure. The heroes are a little boy and his dog.

            Assistant: Great outline! Next, let's settle some key plot points. For example, the boy and his \
            dog find a mysterious map in the woods near their home and follow its clues through the forest. \
            In the end they find a treasure, but realise the real treasure is their friendship. How does that sound?

            Human: Please add more details about the forest.

            Assistant: Understood, one moment while I write the story:

            One sunny morning, Tommy and his dog Max found a mysterious map that the wind had blown into the backyard.

            They decided to go looking for the treasure, through the forest, over the hills and across a long, wide river.

            Hand in hand they crossed the river. Suddenly a big bear jumped out, and together they chased it away.

            At last they found the treasure and walked home in the sunset.

            The story is ready. Next we can illustrate it. Which style do you prefer, cartoon or cyberpunk?

            Human: I prefer cyberpunk.

            Assistant: Great, I will illustrate each scene.

            Illustrating scene one: %1$s```JSON
            {"api_name": "image_generation", "parameters": {"text": "One sunny morning, Tommy and his dog Max found a mysterious map that the wind had blown into the backyard.", "idx": "0", "type": "cyberpunk"}}
            ```%2$s

            Illustrating scene two: %1$s```JSON
            {"api_name": "image_generation", "parameters": {"text": "They decided to go looking for the treasure, through the forest, over the hills and across a long, wide river.", "idx": "1", "type": "cyberpunk"}}
            ```%2$s

            Every scene now has an illustration. Let me know if you would like to change anything.

            [Role-play requirements]
            The conversation above shows how to guide the user through creating a picture book. Follow \
            the same steps, reply only to the user's current message and never write further turns of \
            the conversation. Do not include anything after %3$s.
            """;

    private static final String REMINDER_TEMPLATE =
            " (Note: follow the conversation example above, but answer this message only and do not include %s.)";

    private final ObjectMapper    objectMapper;
    private final ToolRegistry    toolRegistry;
    private final StoryProperties properties;

    // ── Build ────────────────────────────────────────────────────────────────

    public List<Message> buildMessages(List<Exchange> memory, String userInput) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(systemPrompt()));

        List<Exchange> window = trim(memory);
        for (Exchange exchange : window) {
            messages.add(Message.user(exchange.userText()));
            messages.add(Message.assistant(exchange.agentText()));
        }
        messages.add(Message.user(userInput + REMINDER_TEMPLATE.formatted(properties.stopMarker())));

        log.debug("[Context] Built {} message(s), {} of {} exchange(s) kept",
                messages.size(), window.size(), memory.size());
        return messages;
    }

    String systemPrompt() {
        String start = properties.startMarker();
        String end   = properties.endMarker();
        return SYSTEM_TEMPLATE.formatted(start, end, toolListJson())
                + "\n"
                + INSTRUCTION_TEMPLATE.formatted(start, end, properties.stopMarker());
    }

    // ── Trim ─────────────────────────────────────────────────────────────────

    /** Sliding window over whole exchanges, newest kept. */
    private List<Exchange> trim(List<Exchange> memory) {
        int window = Math.max(0, properties.memoryWindow());
        if (memory.size() <= window) return memory;
        return memory.subList(memory.size() - window, memory.size());
    }

    // ── Tool list ────────────────────────────────────────────────────────────

    private String toolListJson() {
        List<Map<String, Object>> tools = new ArrayList<>();
        for (ToolDescriptor descriptor : toolRegistry.descriptors()) {
            Map<String, Object> tool = new LinkedHashMap<>();
            tool.put("api_name", descriptor.name());
            tool.put("description", descriptor.description());
            List<Map<String, Object>> parameters = new ArrayList<>();
            for (ToolParameter parameter : descriptor.parameters()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", parameter.name());
                entry.put("description", parameter.description());
                entry.put("type", parameter.type().schemaName());
                entry.put("required", parameter.required());
                parameters.add(entry);
            }
            tool.put("parameters", parameters);
            tools.add(tool);
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tools);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool list", e);
        }
    }
}
