package com.flagship.asset_recycling.exception;

public class NotOwnerException extends RecyclingException {

    public NotOwnerException(String message) {
        super(ErrorKind.NOT_OWNER, message);
    }
}
