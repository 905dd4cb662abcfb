package com.github.dimitryivaniuta.content.publishing.web.dto;

import jakarta.validation.constraints.Size;

/**
 * @param platform target platform; omit to publish to the post's own platform
 */
public record PublishNowRequest(@Size(max = 64) String platform) {}
