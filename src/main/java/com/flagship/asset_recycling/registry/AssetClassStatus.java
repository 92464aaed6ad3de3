package com.flagship.asset_recycling.registry;

/**
 * Lifecycle of an asset class.
 *
 * UNREGISTERED → ACTIVE ⇄ INACTIVE. There is no way back to UNREGISTERED:
 * classes are soft-disabled so that ledger records keep a valid referent.
 */
public enum AssetClassStatus {
    /**
     * Never registered. Only ever reported for unknown ids, never stored.
     */
    UNREGISTERED,

    /**
     * Accepting exchanges.
     */
    ACTIVE,

    /**
     * Registered but not accepting exchanges; config and counters preserved.
     */
    INACTIVE;

    public boolean canTransitionTo(AssetClassStatus target) {
        if (this == target) {
            return true;
        }
        return switch (this) {
            case UNREGISTERED -> target == ACTIVE;
            case ACTIVE -> target == INACTIVE;
            case INACTIVE -> target == ACTIVE;
        };
    }
}
