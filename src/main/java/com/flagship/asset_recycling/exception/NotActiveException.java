package com.flagship.asset_recycling.exception;

/**
 * The asset class is not registered or is currently deactivated.
 */
public class NotActiveException extends RecyclingException {

    public NotActiveException(String message) {
        super(ErrorKind.NOT_ACTIVE, message);
    }
}
