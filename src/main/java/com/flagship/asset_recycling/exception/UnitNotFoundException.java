package com.flagship.asset_recycling.exception;

/**
 * The ownership lookup for a unit failed, so the unit is treated as non-existent.
 */
public class UnitNotFoundException extends RecyclingException {

    public UnitNotFoundException(String message) {
        super(ErrorKind.UNIT_NOT_FOUND, message);
    }

    public UnitNotFoundException(String message, Throwable cause) {
        super(ErrorKind.UNIT_NOT_FOUND, message, cause);
    }
}
