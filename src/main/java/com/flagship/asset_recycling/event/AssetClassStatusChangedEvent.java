package com.flagship.asset_recycling.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AssetClassStatusChangedEvent implements RecyclingEvent {
    UUID eventId;
    String classId;
    boolean active;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetClassStatusChanged";

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

    public static AssetClassStatusChangedEvent of(String classId, boolean active, Instant occurredAt) {
        return new AssetClassStatusChangedEvent(UUID.randomUUID(), classId, active, occurredAt);
    }
}
