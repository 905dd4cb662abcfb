package com.github.dimitryivaniuta.content.publishing.service.publishing;

import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Deterministic local client: always succeeds.
 *
 * <p>Default when {@code app.publisher.mode} is unset, so the service runs without platform access.</p>
 */
@Component
@ConditionalOnProperty(name = "app.publisher.mode", havingValue = "stub", matchIfMissing = true)
public class StubPlatformClient implements PlatformClient {

    private static final Logger log = LoggerFactory.getLogger(StubPlatformClient.class);

    @Override
    public String publish(PublishRequest request, PlatformCredentials credentials) {
        String externalId = "stub-" + request.platform().toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID();
        log.info("Stub publish. postId={} platform={} externalId={}", request.postId(), request.platform(), externalId);
        return externalId;
    }

    @Override
    public boolean requiresCredentials() {
        return false;
    }
}
