package com.flagship.asset_recycling.exception;

/**
 * The collaborator behind an asset class does not answer the ownership-query probe.
 */
public class CapabilityMissingException extends RecyclingException {

    public CapabilityMissingException(String message) {
        super(ErrorKind.CAPABILITY_MISSING, message);
    }

    public CapabilityMissingException(String message, Throwable cause) {
        super(ErrorKind.CAPABILITY_MISSING, message, cause);
    }
}
