package com.github.dimitryivaniuta.content.publishing.service.publishing;

/**
 * Transport to an external publishing platform.
 *
 * <p>Implementations make exactly one attempt per call; retry policy belongs to the lifecycle.</p>
 */
public interface PlatformClient {

    /**
     * Publishes one post.
     *
     * @param request rendered payload
     * @param credentials credentials for the request's platform
     * @return id assigned by the platform
     * @throws PublishException on any failure
     */
    String publish(PublishRequest request, PlatformCredentials credentials);

    /**
     * Whether {@link PostPublisher} must resolve credentials before calling this client.
     *
     * @return true by default
     */
    default boolean requiresCredentials() {
        return true;
    }
}
