package com.github.dimitryivaniuta.content.publishing.service.publishing;

/**
 * Rendered payload handed to a {@link PlatformClient}.
 *
 * @param postId post id, also used by the platform gateway for de-duplication
 * @param platform target platform
 * @param content text to publish
 */
public record PublishRequest(String postId, String platform, String content) {}
