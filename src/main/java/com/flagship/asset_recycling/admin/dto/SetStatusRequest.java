package com.flagship.asset_recycling.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetStatusRequest {

    @NotNull(message = "Active flag is required")
    @JsonProperty("active")
    private Boolean active;
}
