package com.flagship.asset_recycling.recycle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_recycling.ledger.DisposalMode;
import com.flagship.asset_recycling.ledger.RecyclingRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

@Value
@Builder
public class RecordResponse {

    @JsonProperty("sequence_number")
    long sequenceNumber;

    @JsonProperty("actor")
    String actor;

    @JsonProperty("class_id")
    String classId;

    @JsonProperty("unit_id")
    BigInteger unitId;

    @JsonProperty("points_generated")
    long pointsGenerated;

    @JsonProperty("disposal_mode")
    DisposalMode disposalMode;

    @JsonProperty("timestamp")
    Instant timestamp;

    public static RecordResponse from(RecyclingRecord record) {
        return RecordResponse.builder()
            .sequenceNumber(record.getSequenceNumber())
            .actor(record.getActor())
            .classId(record.getClassId())
            .unitId(record.getUnitId())
            .pointsGenerated(record.getPointsGenerated())
            .disposalMode(record.getDisposalMode())
            .timestamp(record.getTimestamp())
            .build();
    }
}
