package com.flagship.asset_recycling.outbox;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory outbox table, ordered by sequence number.
 *
 * Published events are removed. While the publisher is disabled nothing drains
 * the table, so it keeps only the newest {@code outbox.retention.max-events}
 * events and drops the oldest first.
 *
 * All methods are synchronized; contention is limited to the commit path and
 * the publisher.
 */
@Component
@Slf4j
public class OutboxEventStore {

    private final Map<UUID, OutboxEvent> events = new LinkedHashMap<>();
    private long nextSequence = 1;
    private long evictedUnpublished;

    @Value("${outbox.publisher.enabled:false}")
    private boolean publisherEnabled = false;

    @Value("${outbox.retention.max-events:10000}")
    private int maxRetainedEvents = 10000;

    public synchronized long nextSequenceNumber() {
        return nextSequence++;
    }

    public synchronized OutboxEvent save(OutboxEvent event) {
        if (!events.containsKey(event.getId())) {
            evictOldestIfFull();
        }
        events.put(event.getId(), event);
        return event;
    }

    public synchronized Optional<OutboxEvent> remove(UUID id) {
        return Optional.ofNullable(events.remove(id));
    }

    public synchronized Optional<OutboxEvent> findById(UUID id) {
        return Optional.ofNullable(events.get(id));
    }

    public synchronized List<OutboxEvent> findUnpublished(int limit, int maxRetries) {
        List<OutboxEvent> result = new ArrayList<>();
        for (OutboxEvent event : events.values()) {
            if (result.size() >= limit) {
                break;
            }
            if (event.getRetryCount() < maxRetries) {
                result.add(event);
            }
        }
        return result;
    }

    public synchronized List<OutboxEvent> findByAggregate(String aggregateType, String aggregateKey) {
        return events.values().stream()
                .filter(e -> e.getAggregateType().equals(aggregateType))
                .filter(e -> e.getAggregateKey().equals(aggregateKey))
                .toList();
    }

    public synchronized List<OutboxEvent> findByEventType(String eventType) {
        return events.values().stream()
                .filter(e -> e.getEventType().equals(eventType))
                .toList();
    }

    public synchronized long countUnpublished() {
        return events.size();
    }

    public synchronized long countDeadLettered(int maxRetries) {
        return events.values().stream()
                .filter(e -> e.getRetryCount() >= maxRetries)
                .count();
    }

    public synchronized Optional<Instant> findOldestUnpublishedCreatedAt() {
        return events.values().stream()
                .map(OutboxEvent::getCreatedAt)
                .min(Instant::compareTo);
    }

    private void evictOldestIfFull() {
        if (publisherEnabled || events.size() < maxRetainedEvents) {
            return;
        }
        Iterator<OutboxEvent> oldest = events.values().iterator();
        OutboxEvent dropped = oldest.next();
        oldest.remove();
        evictedUnpublished++;
        if (evictedUnpublished == 1 || evictedUnpublished % maxRetainedEvents == 0) {
            log.info("Outbox publisher disabled; dropped {} unpublished events past the retention limit of {}",
                    evictedUnpublished, maxRetainedEvents);
        }
        log.debug("Evicted outbox event {} ({})", dropped.getId(), dropped.getEventType());
    }
}
