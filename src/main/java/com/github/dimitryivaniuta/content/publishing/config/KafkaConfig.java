package com.github.dimitryivaniuta.content.publishing.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration.
 */
@Configuration
public class KafkaConfig {

    /**
     * Lifecycle events topic, keyed by post id so one post's events stay ordered in a partition.
     *
     * <p>Production topics are usually provisioned by IaC; set {@code app.outbox.create-topic=false} there.</p>
     *
     * @param props application properties
     * @return topic definition
     */
    @Bean
    @ConditionalOnProperty(name = "app.outbox.create-topic", havingValue = "true", matchIfMissing = true)
    public NewTopic postLifecycleEventsTopic(AppProperties props) {
        return TopicBuilder.name(props.getOutbox().getEventsTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
