package com.github.dimitryivaniuta.content.publishing.service.publishing;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Publishes through the platform gateway over HTTP.
 *
 * <p>{@code POST /platforms/{platform}/posts} with a bearer token and {@code {postId, content}};
 * the gateway answers {@code {"id": "..."}}. Status codes map to {@link PublishFailureKind}:
 * 401/403 AUTHENTICATION, 429 RATE_LIMITED, other 4xx REJECTED, 5xx GENERIC.</p>
 */
@Component
@ConditionalOnProperty(name = "app.publisher.mode", havingValue = "http")
public class HttpPlatformClient implements PlatformClient {

    private static final Logger log = LoggerFactory.getLogger(HttpPlatformClient.class);

    static final String PUBLISH_PATH = "/platforms/{platform}/posts";

    private final RestTemplate restTemplate;

    public HttpPlatformClient(@Qualifier("platformRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public String publish(PublishRequest request, PlatformCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(credentials.accessToken());

        Map<String, String> body = Map.of("postId", request.postId(), "content", request.content());

        PlatformPostResponse response;
        try {
            response = restTemplate.postForObject(PUBLISH_PATH, new HttpEntity<>(body, headers),
                    PlatformPostResponse.class, request.platform());
        } catch (RestClientResponseException ex) {
            throw mapStatus(ex.getStatusCode(), ex);
        } catch (ResourceAccessException ex) {
            if (ex.getCause() instanceof SocketTimeoutException) {
                throw new PublishException(PublishFailureKind.TIMEOUT, "platform gateway timed out: " + ex.getMessage(), ex);
            }
            throw new PublishException(PublishFailureKind.GENERIC, "platform gateway unreachable: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new PublishException(PublishFailureKind.GENERIC, "platform gateway call failed: " + ex.getMessage(), ex);
        }

        if (response == null || response.id() == null || response.id().isBlank()) {
            throw new PublishException(PublishFailureKind.GENERIC, "platform gateway returned no post id");
        }
        log.debug("Platform accepted post. postId={} platform={} externalId={}", request.postId(), request.platform(), response.id());
        return response.id();
    }

    static PublishException mapStatus(HttpStatusCode status, RestClientResponseException ex) {
        int code = status.value();
        String detail = "platform gateway answered " + code + ": " + ex.getResponseBodyAsString();
        if (code == 401 || code == 403) {
            return new PublishException(PublishFailureKind.AUTHENTICATION, detail, ex);
        }
        if (code == 429) {
            return new PublishException(PublishFailureKind.RATE_LIMITED, detail, ex);
        }
        if (status.is4xxClientError()) {
            return new PublishException(PublishFailureKind.REJECTED, detail, ex);
        }
        return new PublishException(PublishFailureKind.GENERIC, detail, ex);
    }

    /**
     * Gateway response body.
     *
     * @param id platform post id
     */
    public record PlatformPostResponse(String id) {}
}
