package com.flagship.asset_recycling.event;

import com.flagship.asset_recycling.registry.AssetClassConfig;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a class becomes accepted, either for the first time or by
 * re-registering a deactivated class.
 */
@Value
public class AssetClassRegisteredEvent implements RecyclingEvent {
    UUID eventId;
    String classId;
    long pointsPerUnit;
    boolean reactivated;
    Instant registeredAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetClassRegistered";

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

    public static AssetClassRegisteredEvent from(AssetClassConfig config, boolean reactivated, Instant occurredAt) {
        return new AssetClassRegisteredEvent(
            UUID.randomUUID(),
            config.getClassId(),
            config.getPointsPerUnit(),
            reactivated,
            config.getRegisteredAt(),
            occurredAt
        );
    }
}
