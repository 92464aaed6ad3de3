package com.flagship.asset_recycling.config;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime settings for the recycling core.
 *
 * Built from application properties by {@link RecyclingConfig}; tests build it directly.
 */
@Value
@Builder
public class RecyclingSettings {

    public static final long DEFAULT_MAX_POINTS_PER_UNIT = 10_000L;

    /**
     * Identity allowed to perform administrative operations.
     */
    String adminAddress;

    /**
     * Identity that receives units on custodial exchanges.
     */
    String custodyAddress;

    /**
     * Upper bound (inclusive) for a class rate.
     */
    long maxPointsPerUnit;
}
