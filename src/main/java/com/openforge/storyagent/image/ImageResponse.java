package com.openforge.storyagent.image;

import java.util.List;

/**
 * Response from /images/generations. Each entry carries either a hosted
 * {@code url} or an inline {@code b64_json} payload, depending on the
 * provider.
 */
public record ImageResponse(
        Long            created,
        List<ImageData> data
) {

    public record ImageData(
            String url,
            String b64Json,
            String revisedPrompt
    ) {}
}
