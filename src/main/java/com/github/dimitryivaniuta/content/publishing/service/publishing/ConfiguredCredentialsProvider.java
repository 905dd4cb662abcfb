package com.github.dimitryivaniuta.content.publishing.service.publishing;

import com.github.dimitryivaniuta.content.publishing.config.AppProperties;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Reads {@code app.publisher.credentials.<platform>.access-token}.
 */
@Component
public class ConfiguredCredentialsProvider implements PlatformCredentialsProvider {

    private final AppProperties properties;

    public ConfiguredCredentialsProvider(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<PlatformCredentials> credentialsFor(String platform) {
        if (platform == null) {
            return Optional.empty();
        }
        String wanted = platform.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, AppProperties.Publisher.Credentials> e : properties.getPublisher().getCredentials().entrySet()) {
            String token = e.getValue() == null ? null : e.getValue().getAccessToken();
            if (e.getKey().toLowerCase(Locale.ROOT).equals(wanted) && token != null && !token.isBlank()) {
                return Optional.of(new PlatformCredentials(wanted, token));
            }
        }
        return Optional.empty();
    }
}
