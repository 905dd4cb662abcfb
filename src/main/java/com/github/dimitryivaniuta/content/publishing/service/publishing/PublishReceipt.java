package com.github.dimitryivaniuta.content.publishing.service.publishing;

/**
 * Successful publish outcome.
 *
 * @param externalPostId id assigned by the platform
 */
public record PublishReceipt(String externalPostId) {}
