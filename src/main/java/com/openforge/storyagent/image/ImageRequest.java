package com.openforge.storyagent.image;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of an OpenAI-compatible POST /images/generations request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImageRequest(
        String  model,
        String  prompt,
        Integer n,
        String  size
) {

    public static ImageRequest single(String model, String prompt, String size) {
        return new ImageRequest(model, prompt, 1, size);
    }
}
