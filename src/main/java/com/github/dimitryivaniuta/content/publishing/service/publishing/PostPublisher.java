package com.github.dimitryivaniuta.content.publishing.service.publishing;

import com.github.dimitryivaniuta.content.publishing.config.AppProperties;
import com.github.dimitryivaniuta.content.publishing.domain.Post;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * One bounded-time publish attempt per claimed post.
 *
 * <p>The platform call runs on the publish executor and is abandoned (interrupted) once
 * {@code app.scheduler.publish-timeout} elapses. There is no retry here.</p>
 */
@Component
public class PostPublisher {

    private final PlatformClient platformClient;
    private final PlatformCredentialsProvider credentialsProvider;
    private final ExecutorService publishExecutor;
    private final AppProperties properties;

    public PostPublisher(
            PlatformClient platformClient,
            PlatformCredentialsProvider credentialsProvider,
            @Qualifier("publishExecutor") ExecutorService publishExecutor,
            AppProperties properties
    ) {
        this.platformClient = platformClient;
        this.credentialsProvider = credentialsProvider;
        this.publishExecutor = publishExecutor;
        this.properties = properties;
    }

    /**
     * Publishes the post's current content to its platform.
     *
     * @param post claimed post
     * @return receipt with the platform id
     * @throws PublishException on failure, timeout included
     */
    public PublishReceipt publish(Post post) {
        PublishRequest request = new PublishRequest(post.getId(), post.getPlatform(), post.getContent());
        PlatformCredentials credentials = resolveCredentials(post.getPlatform());
        Duration timeout = properties.getScheduler().getPublishTimeout();

        Future<String> call;
        try {
            call = publishExecutor.submit(() -> platformClient.publish(request, credentials));
        } catch (RejectedExecutionException ex) {
            throw new PublishException(PublishFailureKind.GENERIC, "publish executor rejected the call", ex);
        }

        String externalId;
        try {
            externalId = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            call.cancel(true);
            throw new PublishException(PublishFailureKind.TIMEOUT, "no answer from " + post.getPlatform() + " within " + timeout, ex);
        } catch (InterruptedException ex) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new PublishException(PublishFailureKind.GENERIC, "interrupted while publishing", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof PublishException) {
                throw (PublishException) cause;
            }
            String msg = cause == null || cause.getMessage() == null ? String.valueOf(cause) : cause.getMessage();
            throw new PublishException(PublishFailureKind.GENERIC, msg, cause);
        }

        if (externalId == null || externalId.isBlank()) {
            throw new PublishException(PublishFailureKind.GENERIC, post.getPlatform() + " returned an empty post id");
        }
        return new PublishReceipt(externalId);
    }

    private PlatformCredentials resolveCredentials(String platform) {
        if (!platformClient.requiresCredentials()) {
            return PlatformCredentials.anonymous(platform);
        }
        return credentialsProvider.credentialsFor(platform)
                .orElseThrow(() -> new PublishException(PublishFailureKind.AUTHENTICATION,
                        "no credentials configured for platform " + platform));
    }
}
