package com.flagship.asset_recycling.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published for each batch item that could not be exchanged.
 *
 * {@code reason} is the stable error label; {@code detail} is the human-readable message.
 */
@Value
public class RecyclingFailedEvent implements RecyclingEvent {
    UUID eventId;
    String actor;
    String classId;
    BigInteger unitId;
    String reason;
    String detail;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RecyclingFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_RECYCLING;
    }

    @Override
    public String getAggregateKey() {
        return classId != null ? classId : "unknown";
    }

    public static RecyclingFailedEvent of(String actor, String classId, BigInteger unitId,
                                          String reason, String detail, Instant occurredAt) {
        return new RecyclingFailedEvent(UUID.randomUUID(), actor, classId, unitId, reason, detail, occurredAt);
    }
}
