package com.flagship.asset_recycling.exception;

/**
 * The asset class has never been registered.
 */
public class NotRegisteredException extends RecyclingException {

    public NotRegisteredException(String message) {
        super(ErrorKind.NOT_REGISTERED, message);
    }
}
