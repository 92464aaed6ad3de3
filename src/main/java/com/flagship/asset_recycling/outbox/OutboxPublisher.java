package com.flagship.asset_recycling.outbox;

import com.flagship.asset_recycling.event.RecyclingEvent;
import com.flagship.asset_recycling.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Background publisher that drains the outbox into Kafka.
 *
 * - Publishes in sequence order, synchronously, one event at a time
 * - Uses the aggregate key (class id) as the record key for per-class ordering
 * - Failed sends increment the retry count; events at max retries are skipped
 *   by {@link OutboxService#findUnpublishedEvents} and reported as dead letters
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.recycling:asset-recycling}")
    private String recyclingTopic;

    @Value("${kafka.topic.admin:asset-recycling-admin}")
    private String adminTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());

            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = getTopicForEvent(event);

        try {
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(topic, event.getAggregateKey(), event.getPayload());

            SendResult<String, String> result = future.get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (event.getRetryCount() + 1 >= outboxService.getMaxRetries()) {
                log.warn("Event {} reached max retries ({}), moving to dead letter. eventType={}, aggregateKey={}",
                        event.getId(), outboxService.getMaxRetries(), event.getEventType(), event.getAggregateKey());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    private String getTopicForEvent(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case RecyclingEvent.AGGREGATE_ADMIN -> adminTopic;
            default -> recyclingTopic;
        };
    }

    /**
     * Manually triggers publishing.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
