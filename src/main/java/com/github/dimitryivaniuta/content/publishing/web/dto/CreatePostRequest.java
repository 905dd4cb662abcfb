package com.github.dimitryivaniuta.content.publishing.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Draft creation request.
 *
 * @param platform target platform, e.g. {@code linkedin}
 * @param content text to publish
 */
public record CreatePostRequest(
        @NotBlank @Size(max = 64) String platform,
        @NotBlank @Size(max = 10_000) String content
) {}
