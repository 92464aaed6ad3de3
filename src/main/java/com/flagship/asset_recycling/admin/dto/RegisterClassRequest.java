package com.flagship.asset_recycling.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for registering an asset class. Range checks on the rate are
 * done by the registry against the configured maximum.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterClassRequest {

    @NotBlank(message = "Asset class id is required")
    @JsonProperty("class_id")
    private String classId;

    @NotNull(message = "Points per unit is required")
    @JsonProperty("points_per_unit")
    private Long pointsPerUnit;
}
