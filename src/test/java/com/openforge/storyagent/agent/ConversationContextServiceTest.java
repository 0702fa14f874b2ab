package com.openforge.storyagent.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storyagent.config.StoryProperties;
import com.openforge.storyagent.engine.Exchange;
import com.openforge.storyagent.llm.model.Message;
import com.openforge.storyagent.tool.ToolRegistry;
import com.openforge.storyagent.tool.builtin.PrintStoryTool;
import com.openforge.storyagent.tool.builtin.ShowExampleTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationContextServiceTest {

    private StoryProperties properties;
    private ConversationContextService service;

    @BeforeEach
    void setUp() {
        properties = new StoryProperties(4, "<|startofthink|>", "<|endofthink|>", "<|user|>",
                "Hello", List.of("cartoon.png"), 120, 2);
        ToolRegistry registry = new ToolRegistry(List.of(new PrintStoryTool(), new ShowExampleTool(properties)));
        service = new ConversationContextService(new ObjectMapper(), registry, properties);
    }

    @Test
    void shouldDescribeToolsAndMarkersInSystemPrompt() {
        List<Message> messages = service.buildMessages(List.of(), "a story about a dog");

        Message system = messages.get(0);
        assertEquals("system", system.role());
        assertTrue(system.content().contains("<|startofthink|>"));
        assertTrue(system.content().contains("<|endofthink|>"));
        assertTrue(system.content().contains("\"api_name\" : \"print_story_tool\""));
        assertTrue(system.content().contains("\"api_name\" : \"show_image_example\""));
        assertTrue(system.content().contains("\"required\" : true"));
        assertTrue(system.content().contains("\"api_name\": \"image_generation\""));
    }

    @Test
    void shouldAppendReminderToUserInput() {
        List<Message> messages = service.buildMessages(List.of(), "a story about a dog");

        assertEquals(2, messages.size());
        Message user = messages.get(1);
        assertEquals("user", user.role());
        assertTrue(user.content().startsWith("a story about a dog (Note:"));
        assertTrue(user.content().contains("<|user|>"));
    }

    @Test
    void shouldReplayMemoryAsAlternatingMessages() {
        List<Message> messages = service.buildMessages(List.of(new Exchange("hi", "hello there")), "next");

        assertEquals(List.of("system", "user", "assistant", "user"),
                messages.stream().map(Message::role).toList());
        assertEquals("hi", messages.get(1).content());
        assertEquals("hello there", messages.get(2).content());
    }

    @Test
    void shouldKeepOnlyNewestExchangesInWindow() {
        List<Exchange> memory = List.of(
                new Exchange("one", "1"),
                new Exchange("two", "2"),
                new Exchange("three", "3"));

        List<Message> messages = service.buildMessages(memory, "four");

        assertEquals(6, messages.size());
        assertEquals("system", messages.get(0).role());
        assertEquals("two", messages.get(1).content());
        assertEquals("three", messages.get(3).content());
    }
}
