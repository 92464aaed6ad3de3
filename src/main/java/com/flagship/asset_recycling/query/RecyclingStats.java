package com.flagship.asset_recycling.query;

import lombok.Value;

@Value
public class RecyclingStats {
    long totalRecyclings;
    long totalPointsGenerated;
    long activeClassCount;
}
