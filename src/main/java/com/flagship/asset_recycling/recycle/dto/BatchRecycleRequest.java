package com.flagship.asset_recycling.recycle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

/**
 * Request body for a batch exchange.
 *
 * Items are not bean-validated. A malformed item fails on its own inside
 * the batch and does not reject the whole request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchRecycleRequest {

    @NotNull(message = "Items are required")
    @JsonProperty("items")
    private List<Item> items;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {

        @JsonProperty("class_id")
        private String classId;

        @JsonProperty("unit_id")
        private BigInteger unitId;

        @JsonProperty("use_destruction")
        private Boolean useDestruction;
    }
}
