package com.flagship.asset_recycling.exception;

/**
 * Raised when an exchange is attempted while another one is already running on
 * the same thread, typically from inside a collaborator callback.
 */
public class ReentrantCallException extends RecyclingException {

    public ReentrantCallException(String message) {
        super(ErrorKind.REENTRANT_CALL, message);
    }
}
