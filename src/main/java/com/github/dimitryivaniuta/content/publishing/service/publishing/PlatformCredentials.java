package com.github.dimitryivaniuta.content.publishing.service.publishing;

/**
 * Access credentials for one platform.
 *
 * @param platform platform name
 * @param accessToken bearer token, null for clients that need none
 */
public record PlatformCredentials(String platform, String accessToken) {

    /**
     * Credentials for clients that do not authenticate.
     *
     * @param platform platform name
     * @return credentials without a token
     */
    public static PlatformCredentials anonymous(String platform) {
        return new PlatformCredentials(platform, null);
    }

    @Override
    public String toString() {
        return "PlatformCredentials[platform=" + platform + ", accessToken=" + (accessToken == null ? "none" : "***") + "]";
    }
}
