package com.github.dimitryivaniuta.content.publishing.service;

import com.github.dimitryivaniuta.content.publishing.config.AppProperties;
import com.github.dimitryivaniuta.content.publishing.domain.OutboxEvent;
import com.github.dimitryivaniuta.content.publishing.domain.OutboxStatus;
import com.github.dimitryivaniuta.content.publishing.repo.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Relays post lifecycle events from the outbox to Kafka.
 *
 * <p>Each record is keyed by post id, so one post's events stay on one partition, and carries
 * the {@code eventType} and {@code postVersion} headers for consumers that route or deduplicate
 * without parsing the payload. An event counts as relayed only after the broker acknowledged it
 * within {@code send-timeout}; otherwise it is retried with capped exponential backoff until
 * {@code max-attempts}, then parked as DEAD. Delivery is at-least-once.</p>
 */
@Component
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    static final String HEADER_EVENT_TYPE = "eventType";
    static final String HEADER_POST_VERSION = "postVersion";

    private static final int MAX_ERROR_LENGTH = 2000;

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties properties;
    private final Clock clock;

    private final Counter relayedCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;

    public OutboxDispatcher(
            OutboxEventRepository outboxEventRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            AppProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
        this.clock = clock;

        this.relayedCounter = Counter.builder("posts.outbox.sent").register(meterRegistry);
        this.retryCounter = Counter.builder("posts.outbox.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("posts.outbox.dead").register(meterRegistry);
    }

    /**
     * Relays one batch of due events. Status changes are flushed when the transaction commits.
     *
     * @return number of events relayed
     */
    @Scheduled(fixedDelayString = "${app.outbox.publish-interval-ms:1000}")
    @Transactional
    public int relayBatch() {
        AppProperties.Outbox cfg = properties.getOutbox();
        List<OutboxEvent> batch = outboxEventRepository.lockRelayBatch(clock.instant(), cfg.getBatchSize());

        int relayed = 0;
        for (OutboxEvent event : batch) {
            if (relay(event, cfg) == OutboxStatus.RELAYED) {
                relayed++;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Outbox relay interrupted; remaining events stay due");
                break;
            }
        }

        if (!batch.isEmpty()) {
            log.info("Outbox relay batch done. events={} relayed={} topic={}", batch.size(), relayed, cfg.getEventsTopic());
        }
        return relayed;
    }

    private OutboxStatus relay(OutboxEvent event, AppProperties.Outbox cfg) {
        try {
            kafkaTemplate.send(toRecord(event, cfg.getEventsTopic()))
                    .get(cfg.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            event.markRelayed(clock.instant());
            relayedCounter.increment();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            event.markRetry(errorText(ex), clock.instant().plus(cfg.getBaseBackoff()));
            retryCounter.increment();
        } catch (ExecutionException | TimeoutException | RuntimeException ex) {
            recordFailure(event, cfg, errorText(ex));
        }
        return event.getStatus();
    }

    private void recordFailure(OutboxEvent event, AppProperties.Outbox cfg, String error) {
        if (event.isLastAttempt(cfg.getMaxAttempts())) {
            event.markDead(error);
            deadCounter.increment();
            log.error("Outbox event {} ({} of post {} v{}) is DEAD after {} attempts. error={}",
                    event.getId(), event.getEventType(), event.getPostId(), event.getPostVersion(), event.getRelayAttempts(), error);
            return;
        }
        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        Duration delay = backoff(cfg.getBaseBackoff(), cfg.getMaxBackoff(), event.getRelayAttempts() + 1, jitter);
        event.markRetry(error, clock.instant().plus(delay));
        retryCounter.increment();
        log.warn("Outbox event {} ({} of post {}) not relayed. attempt={} retryIn={} error={}",
                event.getId(), event.getEventType(), event.getPostId(), event.getRelayAttempts(), delay, error);
    }

    private static ProducerRecord<String, String> toRecord(OutboxEvent event, String topic) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, event.getPostId(), event.getPayload());
        record.headers().add(HEADER_EVENT_TYPE, event.getEventType().wireName().getBytes(StandardCharsets.UTF_8));
        if (event.getPostVersion() != null) {
            record.headers().add(HEADER_POST_VERSION, event.getPostVersion().toString().getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }

    /**
     * Delay before relay attempt {@code attempt + 1}: {@code base * 2^(attempt-1)} scaled by
     * {@code jitter}, never below {@code base} nor above {@code max}.
     */
    static Duration backoff(Duration base, Duration max, int attempt, double jitter) {
        int doublings = Math.min(Math.max(attempt - 1, 0), 30);
        long exponentialMs = Math.min(base.toMillis() << doublings, max.toMillis());
        long jitteredMs = (long) (exponentialMs * jitter);
        return Duration.ofMillis(Math.max(base.toMillis(), Math.min(jitteredMs, max.toMillis())));
    }

    private static String errorText(Exception ex) {
        Throwable cause = ex instanceof ExecutionException && ex.getCause() != null ? ex.getCause() : ex;
        String msg = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return msg.length() > MAX_ERROR_LENGTH ? msg.substring(0, MAX_ERROR_LENGTH) : msg;
    }
}
