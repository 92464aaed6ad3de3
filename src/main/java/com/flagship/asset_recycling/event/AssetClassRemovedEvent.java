package com.flagship.asset_recycling.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published on deactivation. Removal is soft: configuration and history stay.
 */
@Value
public class AssetClassRemovedEvent implements RecyclingEvent {
    UUID eventId;
    String classId;
    long totalRecycled;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetClassRemoved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_ASSET_CLASS;
    }

    @Override
    public String getAggregateKey() {
        return classId;
    }

    public static AssetClassRemovedEvent of(String classId, long totalRecycled, Instant occurredAt) {
        return new AssetClassRemovedEvent(UUID.randomUUID(), classId, totalRecycled, occurredAt);
    }
}
