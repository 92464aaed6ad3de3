package com.flagship.asset_recycling.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for every observation the recycling core emits.
 *
 * Events are facts: they are created once, after the state change they
 * describe has been applied, and are never modified.
 */
public interface RecyclingEvent {

    String AGGREGATE_ASSET_CLASS = "AssetClass";
    String AGGREGATE_RECYCLING = "Recycling";
    String AGGREGATE_ADMIN = "Admin";

    /**
     * Unique identifier for this event instance, used by consumers for deduplication.
     */
    UUID getEventId();

    /**
     * Aggregate family, used for topic routing.
     */
    String getAggregateType();

    /**
     * Aggregate key; also the Kafka partition key.
     */
    String getAggregateKey();

    Instant getOccurredAt();

    String getEventType();
}
