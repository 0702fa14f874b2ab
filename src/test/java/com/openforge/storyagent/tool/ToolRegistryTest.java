package com.openforge.storyagent.tool;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private static ToolDescriptor descriptor(String name) {
        return ToolDescriptor.builder()
                .name(name)
                .capability(arguments -> null)
                .build();
    }

    @Test
    void shouldKeepRegistrationOrder() {
        ToolRegistry registry = new ToolRegistry(List.of(() -> descriptor("b"), () -> descriptor("a")));

        assertEquals(List.of("b", "a"), registry.names());
        assertEquals(2, registry.size());
    }

    @Test
    void shouldRejectDuplicateName() {
        ToolRegistry registry = new ToolRegistry(List.of(() -> descriptor("a")));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> registry.register(descriptor("a")));
        assertEquals("Tool already registered: a", error.getMessage());
    }

    @Test
    void shouldFindRegisteredTool() {
        ToolRegistry registry = new ToolRegistry(List.of());
        registry.register(descriptor("late"));

        assertTrue(registry.find("late").isPresent());
        assertTrue(registry.find("missing").isEmpty());
    }

    @Test
    void shouldDefaultDescriptorFields() {
        ToolDescriptor descriptor = descriptor("x");

        assertEquals("", descriptor.description());
        assertTrue(descriptor.parameters().isEmpty());
        assertTrue(descriptor.resultContract().toSlotUpdates(ToolArguments.empty(), "r").isEmpty());
    }

    @Test
    void shouldRejectDescriptorWithoutCapability() {
        assertThrows(IllegalArgumentException.class,
                () -> ToolDescriptor.builder().name("x").build());
    }
}
