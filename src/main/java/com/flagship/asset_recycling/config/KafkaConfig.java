package com.flagship.asset_recycling.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for recycling observations.
 *
 * Only active together with the outbox publisher, so the service starts
 * without a broker when events stay in the local outbox.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${kafka.topic.recycling:asset-recycling}")
    private String recyclingTopic;

    @Value("${kafka.topic.admin:asset-recycling-admin}")
    private String adminTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic recyclingTopic() {
        return TopicBuilder.name(recyclingTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic adminTopic() {
        return TopicBuilder.name(adminTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
