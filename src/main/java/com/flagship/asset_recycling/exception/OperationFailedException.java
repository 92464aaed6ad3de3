package com.flagship.asset_recycling.exception;

/**
 * A disposal (destroy or custody transfer) call into the collaborator failed.
 */
public class OperationFailedException extends RecyclingException {

    public OperationFailedException(String message) {
        super(ErrorKind.OPERATION_FAILED, message);
    }

    public OperationFailedException(String message, Throwable cause) {
        super(ErrorKind.OPERATION_FAILED, message, cause);
    }
}
