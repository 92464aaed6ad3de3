package com.flagship.asset_recycling.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_recycling.registry.AssetClassConfig;
import com.flagship.asset_recycling.registry.AssetClassStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Asset class view shared by the admin and query endpoints.
 */
@Value
@Builder
public class AssetClassResponse {

    @JsonProperty("class_id")
    String classId;

    @JsonProperty("points_per_unit")
    long pointsPerUnit;

    @JsonProperty("status")
    AssetClassStatus status;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("total_recycled")
    long totalRecycled;

    @JsonProperty("registered_at")
    Instant registeredAt;

    public static AssetClassResponse from(AssetClassConfig config) {
        return AssetClassResponse.builder()
            .classId(config.getClassId())
            .pointsPerUnit(config.getPointsPerUnit())
            .status(config.getStatus())
            .active(config.isActive())
            .totalRecycled(config.getTotalRecycled())
            .registeredAt(config.getRegisteredAt())
            .build();
    }
}
