package com.github.dimitryivaniuta.content.publishing.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the platform gateway.
 */
@Configuration
@ConditionalOnProperty(name = "app.publisher.mode", havingValue = "http")
public class HttpClientConfig {

    /**
     * RestTemplate with connect/read timeouts; the scheduler's publish timeout still caps the whole call.
     *
     * @param builder boot-provided builder
     * @param properties app properties
     * @return rest template
     */
    @Bean
    public RestTemplate platformRestTemplate(RestTemplateBuilder builder, AppProperties properties) {
        AppProperties.Publisher publisher = properties.getPublisher();
        return builder
                .rootUri(publisher.getBaseUrl())
                .setConnectTimeout(publisher.getConnectTimeout())
                .setReadTimeout(publisher.getReadTimeout())
                .build();
    }
}
