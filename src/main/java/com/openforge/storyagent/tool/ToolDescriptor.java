package com.openforge.storyagent.tool;

import lombok.Builder;
import lombok.Singular;

import java.util.List;

/**
 * Everything the engine knows about a tool: its registry key, the schema the
 * invoker validates against, the capability to run and where the result goes.
 */
@Builder
public record ToolDescriptor(
        String              name,
        String              description,
        @Singular
        List<ToolParameter> parameters,
        ToolCapability      capability,
        ResultContract      resultContract
) {

    public ToolDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tool name must not be blank");
        }
        if (capability == null) {
            throw new IllegalArgumentException("tool '%s' has no capability".formatted(name));
        }
        parameters     = parameters == null ? List.of() : List.copyOf(parameters);
        description    = description == null ? "" : description;
        resultContract = resultContract == null ? ResultContract.none() : resultContract;
    }
}
