package com.flagship.asset_recycling.event;

import com.flagship.asset_recycling.ledger.DisposalMode;
import com.flagship.asset_recycling.ledger.RecyclingRecord;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published for every completed exchange.
 *
 * Carries the ledger sequence number so consumers can correlate with
 * {@code GET /api/ledger/{sequence}}.
 */
@Value
public class AssetRecycledEvent implements RecyclingEvent {
    UUID eventId;
    long sequenceNumber;
    String actor;
    String classId;
    BigInteger unitId;
    long pointsGenerated;
    DisposalMode disposalMode;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetRecycled";

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
        return classId;
    }

    public static AssetRecycledEvent fromRecord(RecyclingRecord record) {
        return new AssetRecycledEvent(
            UUID.randomUUID(),
            record.getSequenceNumber(),
            record.getActor(),
            record.getClassId(),
            record.getUnitId(),
            record.getPointsGenerated(),
            record.getDisposalMode(),
            record.getTimestamp()
        );
    }
}
