package com.flagship.asset_recycling.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AssetClassRateUpdatedEvent implements RecyclingEvent {
    UUID eventId;
    String classId;
    long previousPointsPerUnit;
    long pointsPerUnit;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetClassRateUpdated";

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

    public static AssetClassRateUpdatedEvent of(String classId, long previous, long current, Instant occurredAt) {
        return new AssetClassRateUpdatedEvent(UUID.randomUUID(), classId, previous, current, occurredAt);
    }
}
