package com.flagship.asset_recycling.admin;

/**
 * Administrative operations subject to authorization.
 */
public enum AdminOperation {
    REGISTER_CLASS,
    UPDATE_RATE,
    SET_ACTIVE,
    DEACTIVATE_CLASS,
    PAUSE,
    UNPAUSE,
    EMERGENCY_RESCUE
}
