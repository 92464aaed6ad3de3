package com.flagship.asset_recycling.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
public class EmergencyRescueEvent implements RecyclingEvent {
    UUID eventId;
    String classId;
    BigInteger unitId;
    String recipient;
    String performedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EmergencyRescue";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_ADMIN;
    }

    @Override
    public String getAggregateKey() {
        return classId;
    }

    public static EmergencyRescueEvent of(String classId, BigInteger unitId, String recipient,
                                          String performedBy, Instant occurredAt) {
        return new EmergencyRescueEvent(UUID.randomUUID(), classId, unitId, recipient, performedBy, occurredAt);
    }
}
