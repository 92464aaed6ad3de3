package com.flagship.asset_recycling.observability;

import com.flagship.asset_recycling.outbox.OutboxEventStore;
import com.flagship.asset_recycling.outbox.OutboxService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Metrics for the event outbox: backlog, oldest pending age, dead letters,
 * and publish outcomes.
 *
 * Gauges read the in-memory store on scrape; no refresh schedule is needed.
 * Registered only alongside {@link com.flagship.asset_recycling.outbox.OutboxPublisher}.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventStore store;
    private final OutboxService outboxService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", store, OutboxEventStore::countUnpublished)
                .description("Number of unpublished events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", this, OutboxMetrics::oldestPendingAgeSeconds)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", outboxService, OutboxService::countDeadLettered)
                .description("Number of events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        log.info("Outbox metrics registered with Micrometer");
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.event.published", "event_type", eventType).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.event.publish.failure", "event_type", eventType).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.event.dead_letter", "event_type", eventType).increment();
    }

    double oldestPendingAgeSeconds() {
        return store.findOldestUnpublishedCreatedAt()
                .map(oldest -> (double) Duration.between(oldest, clock.instant()).getSeconds())
                .orElse(0.0);
    }
}
