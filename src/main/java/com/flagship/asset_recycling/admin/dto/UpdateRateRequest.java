package com.flagship.asset_recycling.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateRateRequest {

    @NotNull(message = "Points per unit is required")
    @JsonProperty("points_per_unit")
    private Long pointsPerUnit;
}
