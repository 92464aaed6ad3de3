package com.flagship.asset_recycling.recycle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Request body for a single exchange.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecycleRequest {

    @NotBlank(message = "Asset class id is required")
    @JsonProperty("class_id")
    private String classId;

    @NotNull(message = "Unit id is required")
    @JsonProperty("unit_id")
    private BigInteger unitId;
}
