package com.flagship.asset_recycling.registry;

import lombok.Value;

import java.time.Instant;

/**
 * Configuration of one registered asset class.
 *
 * Immutable: every mutation returns a new instance which the registry stores
 * in place of the old one. {@code registeredAt} is set once and carried over
 * by every transition.
 */
@Value
public class AssetClassConfig {
    String classId;
    long pointsPerUnit;
    AssetClassStatus status;
    long totalRecycled;
    Instant registeredAt;

    public static AssetClassConfig register(String classId, long pointsPerUnit, Instant registeredAt) {
        return new AssetClassConfig(classId, pointsPerUnit, AssetClassStatus.ACTIVE, 0L, registeredAt);
    }

    public boolean isActive() {
        return status == AssetClassStatus.ACTIVE;
    }

    public boolean isRegistered() {
        return registeredAt != null;
    }

    public AssetClassConfig withRate(long newPointsPerUnit) {
        return new AssetClassConfig(classId, newPointsPerUnit, status, totalRecycled, registeredAt);
    }

    /**
     * @throws IllegalStateException if the lifecycle forbids the transition
     */
    public AssetClassConfig withStatus(AssetClassStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move asset class %s from %s to %s", classId, status, target));
        }
        return new AssetClassConfig(classId, pointsPerUnit, target, totalRecycled, registeredAt);
    }

    public AssetClassConfig withRecycledIncrement() {
        return new AssetClassConfig(classId, pointsPerUnit, status, Math.addExact(totalRecycled, 1L), registeredAt);
    }
}
