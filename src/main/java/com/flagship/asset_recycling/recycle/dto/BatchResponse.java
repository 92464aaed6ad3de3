package com.flagship.asset_recycling.recycle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_recycling.ledger.DisposalMode;
import com.flagship.asset_recycling.recycle.BatchOutcome;
import com.flagship.asset_recycling.recycle.ItemResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

@Value
@Builder
public class BatchResponse {

    @JsonProperty("total_points")
    long totalPoints;

    @JsonProperty("succeeded")
    long succeeded;

    @JsonProperty("failed")
    long failed;

    @JsonProperty("items")
    List<Item> items;

    @Value
    @Builder
    public static class Item {

        @JsonProperty("index")
        int index;

        @JsonProperty("class_id")
        String classId;

        @JsonProperty("unit_id")
        BigInteger unitId;

        @JsonProperty("disposal_mode")
        DisposalMode disposalMode;

        @JsonProperty("success")
        boolean success;

        @JsonProperty("points_generated")
        long pointsGenerated;

        @JsonProperty("sequence_number")
        Long sequenceNumber;

        @JsonProperty("reason")
        String reason;

        @JsonProperty("detail")
        String detail;

        static Item from(ItemResult result) {
            return Item.builder()
                .index(result.getIndex())
                .classId(result.getClassId())
                .unitId(result.getUnitId())
                .disposalMode(result.getDisposalMode())
                .success(result.isSuccess())
                .pointsGenerated(result.getPointsGenerated())
                .sequenceNumber(result.getSequenceNumber())
                .reason(result.getReason())
                .detail(result.getDetail())
                .build();
        }
    }

    public static BatchResponse from(BatchOutcome outcome) {
        return BatchResponse.builder()
            .totalPoints(outcome.getTotalPoints())
            .succeeded(outcome.getSuccessCount())
            .failed(outcome.getFailureCount())
            .items(outcome.getResults().stream().map(Item::from).toList())
            .build();
    }
}
