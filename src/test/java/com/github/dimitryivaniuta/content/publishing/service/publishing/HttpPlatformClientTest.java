package com.github.dimitryivaniuta.content.publishing.service.publishing;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

/**
 * Status-code mapping of the HTTP platform client against a mocked gateway.
 */
class HttpPlatformClientTest {

    private static final String URL = "http://gateway.test/platforms/linkedin/posts";

    private MockRestServiceServer server;
    private HttpPlatformClient client;

    private final PublishRequest request = new PublishRequest("p-1", "linkedin", "Hello");
    private final PlatformCredentials credentials = new PlatformCredentials("linkedin", "token-1");

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri("http://gateway.test").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HttpPlatformClient(restTemplate);
    }

    @Test
    void postsWithBearerTokenAndReadsId() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer token-1"))
                .andExpect(content().json("{\"postId\":\"p-1\",\"content\":\"Hello\"}"))
                .andRespond(withSuccess("{\"id\":\"urn:li:share:7\"}", MediaType.APPLICATION_JSON));

        Assertions.assertEquals("urn:li:share:7", client.publish(request, credentials));
        server.verify();
    }

    @Test
    void unauthorizedIsAuthenticationFailure() {
        assertKind(HttpStatus.UNAUTHORIZED, PublishFailureKind.AUTHENTICATION);
    }

    @Test
    void forbiddenIsAuthenticationFailure() {
        assertKind(HttpStatus.FORBIDDEN, PublishFailureKind.AUTHENTICATION);
    }

    @Test
    void tooManyRequestsIsRateLimited() {
        assertKind(HttpStatus.TOO_MANY_REQUESTS, PublishFailureKind.RATE_LIMITED);
    }

    @Test
    void otherClientErrorIsRejected() {
        assertKind(HttpStatus.UNPROCESSABLE_ENTITY, PublishFailureKind.REJECTED);
    }

    @Test
    void serverErrorIsGeneric() {
        assertKind(HttpStatus.SERVICE_UNAVAILABLE, PublishFailureKind.GENERIC);
    }

    @Test
    void missingIdIsGeneric() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        PublishException ex = Assertions.assertThrows(PublishException.class, () -> client.publish(request, credentials));
        Assertions.assertEquals(PublishFailureKind.GENERIC, ex.getKind());
    }

    private void assertKind(HttpStatus status, PublishFailureKind expected) {
        server.expect(requestTo(URL)).andRespond(withStatus(status).body("{\"error\":\"x\"}").contentType(MediaType.APPLICATION_JSON));

        PublishException ex = Assertions.assertThrows(PublishException.class, () -> client.publish(request, credentials));

        Assertions.assertEquals(expected, ex.getKind());
        Assertions.assertTrue(ex.getMessage().contains(String.valueOf(status.value())));
        server.verify();
    }
}
