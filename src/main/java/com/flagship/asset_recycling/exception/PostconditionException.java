package com.flagship.asset_recycling.exception;

/**
 * A destroy call reported success but the unit can still be resolved.
 *
 * This indicates a broken collaborator, not a retryable condition.
 */
public class PostconditionException extends RecyclingException {

    public PostconditionException(String message) {
        super(ErrorKind.POSTCONDITION_VIOLATED, message);
    }
}
