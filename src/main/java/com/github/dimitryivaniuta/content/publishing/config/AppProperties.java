package com.github.dimitryivaniuta.content.publishing.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 *
 * <p>One {@link ConfigurationProperties} tree instead of {@code @Value} spread over services.</p>
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private final Lifecycle lifecycle = new Lifecycle();
    private final Scheduler scheduler = new Scheduler();
    private final Publisher publisher = new Publisher();
    private final Outbox outbox = new Outbox();
    private final Cache cache = new Cache();

    @Getter
    @Setter
    public static class Lifecycle {
        /**
         * Failed publication attempts after which RETRY is refused.
         */
        private int maxRetries = 3;
    }

    @Getter
    @Setter
    public static class Scheduler {
        /**
         * Master switch of the due-post scan; reconciliation has its own switch.
         */
        private boolean enabled = true;

        /**
         * Fixed delay between the end of one scan and the start of the next.
         */
        private long scanIntervalMs = 60_000L;

        /**
         * Delay before the first scan after startup.
         */
        private long initialDelayMs = 5_000L;

        /**
         * Max due posts handled per scan; the rest wait for the next scan.
         */
        private int batchSize = 10;

        /**
         * Upper bound for one external publish call.
         */
        private Duration publishTimeout = Duration.ofSeconds(30);

        /**
         * Threads available to run external publish calls.
         */
        private int publishThreads = 4;

        /**
         * Whether PUBLISHING posts left behind by a crash are failed automatically.
         */
        private boolean reconcileEnabled = true;

        /**
         * Age after which a PUBLISHING claim is considered abandoned.
         */
        private Duration staleClaimAfter = Duration.ofMinutes(10);

        /**
         * Delay between stale-claim reconciliation runs.
         */
        private long reconcileIntervalMs = 300_000L;

        /**
         * Whether FAILED posts under the retry cap are retried without a human.
         */
        private boolean autoRetryEnabled = false;

        /**
         * Minimum time between a failed attempt and its automatic retry.
         */
        private Duration autoRetryDelay = Duration.ofMinutes(15);

        /**
         * Delay between automatic retry runs.
         */
        private long autoRetryIntervalMs = 300_000L;
    }

    @Getter
    @Setter
    public static class Publisher {
        /**
         * {@code stub} for a deterministic local publisher, {@code http} for the platform gateway.
         */
        private String mode = "stub";

        /**
         * Base URL of the platform gateway (http mode).
         */
        private String baseUrl = "http://localhost:8088";

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(25);

        /**
         * Credentials per platform name, e.g. {@code app.publisher.credentials.linkedin.access-token}.
         */
        private Map<String, Credentials> credentials = new HashMap<>();

        @Getter
        @Setter
        public static class Credentials {
            private String accessToken;
        }
    }

    @Getter
    @Setter
    public static class Outbox {
        /**
         * Kafka topic for lifecycle events.
         */
        private String eventsTopic = "post-lifecycle-events";

        /**
         * Whether the topic bean is declared (disable where topics come from IaC).
         */
        private boolean createTopic = true;

        private int batchSize = 100;

        /**
         * Fixed delay between relay runs in milliseconds.
         */
        private long publishIntervalMs = 1000L;

        /**
         * Kafka send acknowledgment timeout.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);

        /**
         * Max number of send attempts before moving to DEAD.
         */
        private int maxAttempts = 10;

        private Duration baseBackoff = Duration.ofSeconds(1);

        private Duration maxBackoff = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class Cache {
        /**
         * Redis cache of post snapshots; Postgres stays the source of truth.
         */
        private boolean enabled = true;

        private Duration postTtl = Duration.ofMinutes(10);
    }
}
