package com.flagship.asset_recycling.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.asset_recycling.event.RecyclingEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes observations to the outbox.
 *
 * Callers invoke {@link #saveEvent} inside the same state-lock section that
 * applied the change, so an event exists if and only if its state change
 * does. Publishing to Kafka is left to {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries = 5;

    /**
     * Serializes the event and appends it to the outbox.
     *
     * @throws IllegalArgumentException if the event cannot be serialized
     */
    public OutboxEvent saveEvent(RecyclingEvent event) {
        return save(prepare(event));
    }

    /**
     * Serializes the event into an outbox entry without storing it.
     *
     * @throws IllegalArgumentException if the event cannot be serialized
     */
    public OutboxEvent prepare(RecyclingEvent event) {
        return OutboxEvent.create(
                event.getEventId(),
                event.getAggregateType(),
                event.getAggregateKey(),
                event.getEventType(),
                serializePayload(event),
                clock.instant(),
                store.nextSequenceNumber());
    }

    public OutboxEvent save(OutboxEvent prepared) {
        OutboxEvent saved = store.save(prepared);

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateKey={}",
                saved.getEventType(), saved.getAggregateType(), saved.getAggregateKey());

        return saved;
    }

    /**
     * Drops a sent event from the outbox.
     */
    public void markPublished(UUID eventId) {
        store.remove(eventId).ifPresent(event ->
                log.debug("Published event {} removed from outbox", eventId));
    }

    public void markFailed(UUID eventId, String errorMessage) {
        store.findById(eventId).ifPresent(event -> {
            OutboxEvent retried = store.save(event.markRetry(errorMessage));
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, retried.getRetryCount(), errorMessage);
        });
    }

    public List<OutboxEvent> getEventsForAggregate(String aggregateType, String aggregateKey) {
        return store.findByAggregate(aggregateType, aggregateKey);
    }

    public List<OutboxEvent> getEventsOfType(String eventType) {
        return store.findByEventType(eventType);
    }

    public long countUnpublished() {
        return store.countUnpublished();
    }

    public long countDeadLettered() {
        return store.countDeadLettered(maxRetries);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
