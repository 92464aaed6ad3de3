package com.flagship.asset_recycling.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when recycling is paused or resumed.
 */
@Value
public class PauseStateChangedEvent implements RecyclingEvent {
    UUID eventId;
    boolean paused;
    String changedBy;
    Instant occurredAt;

    public static final String PAUSED_EVENT_TYPE = "RecyclingPaused";
    public static final String UNPAUSED_EVENT_TYPE = "RecyclingUnpaused";

    @Override
    public String getEventType() {
        return paused ? PAUSED_EVENT_TYPE : UNPAUSED_EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_ADMIN;
    }

    @Override
    public String getAggregateKey() {
        return "pause";
    }

    public static PauseStateChangedEvent of(boolean paused, String changedBy, Instant occurredAt) {
        return new PauseStateChangedEvent(UUID.randomUUID(), paused, changedBy, occurredAt);
    }
}
