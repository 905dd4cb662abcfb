package com.github.dimitryivaniuta.content.publishing.service.publishing;

import java.util.Optional;

/**
 * Source of per-platform credentials.
 */
public interface PlatformCredentialsProvider {

    /**
     * Looks up credentials.
     *
     * @param platform platform name, case-insensitive
     * @return credentials, or empty when none are configured
     */
    Optional<PlatformCredentials> credentialsFor(String platform);
}
