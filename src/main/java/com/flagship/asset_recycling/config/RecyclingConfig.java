package com.flagship.asset_recycling.config;

import com.flagship.asset_recycling.admin.AdminAuthorizer;
import com.flagship.asset_recycling.admin.SingleAdminAuthorizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires settings, clock and authorization for the recycling core.
 */
@Configuration
@Slf4j
public class RecyclingConfig {

    @Bean
    public RecyclingSettings recyclingSettings(
            @Value("${recycling.admin-address}") String adminAddress,
            @Value("${recycling.custody-address}") String custodyAddress,
            @Value("${recycling.max-points-per-unit:" + RecyclingSettings.DEFAULT_MAX_POINTS_PER_UNIT + "}")
            long maxPointsPerUnit) {

        if (adminAddress == null || adminAddress.isBlank()) {
            throw new IllegalStateException("recycling.admin-address must be configured");
        }
        if (custodyAddress == null || custodyAddress.isBlank()) {
            throw new IllegalStateException("recycling.custody-address must be configured");
        }
        if (maxPointsPerUnit <= 0) {
            throw new IllegalStateException("recycling.max-points-per-unit must be positive");
        }

        log.info("Recycling configured: admin={}, custody={}, maxPointsPerUnit={}",
                adminAddress, custodyAddress, maxPointsPerUnit);

        return RecyclingSettings.builder()
                .adminAddress(adminAddress)
                .custodyAddress(custodyAddress)
                .maxPointsPerUnit(maxPointsPerUnit)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(AdminAuthorizer.class)
    public AdminAuthorizer adminAuthorizer(RecyclingSettings settings) {
        return new SingleAdminAuthorizer(settings.getAdminAddress());
    }
}
