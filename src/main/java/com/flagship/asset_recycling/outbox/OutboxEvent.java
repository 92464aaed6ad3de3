package com.flagship.asset_recycling.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An observation waiting in the outbox. Published events are evicted from
 * {@link OutboxEventStore}, so every stored event is pending or dead-lettered.
 *
 * Immutable; a failed send produces a new instance that replaces the old one.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "AssetClass"
    String aggregateKey;       // e.g. class id
    String eventType;          // e.g. "AssetRecycled"
    String payload;            // JSON
    Instant createdAt;
    int retryCount;
    String lastError;
    long sequenceNumber;

    public static OutboxEvent create(UUID id, String aggregateType, String aggregateKey,
                                     String eventType, String payload,
                                     Instant createdAt, long sequenceNumber) {
        return new OutboxEvent(
            id,
            aggregateType,
            aggregateKey,
            eventType,
            payload,
            createdAt,
            0,
            null,
            sequenceNumber
        );
    }

    public OutboxEvent markRetry(String errorMessage) {
        return new OutboxEvent(
            this.id,
            this.aggregateType,
            this.aggregateKey,
            this.eventType,
            this.payload,
            this.createdAt,
            this.retryCount + 1,
            errorMessage,
            this.sequenceNumber
        );
    }
}
