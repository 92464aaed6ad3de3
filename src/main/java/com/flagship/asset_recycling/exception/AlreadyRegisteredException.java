package com.flagship.asset_recycling.exception;

public class AlreadyRegisteredException extends RecyclingException {

    public AlreadyRegisteredException(String message) {
        super(ErrorKind.ALREADY_REGISTERED, message);
    }
}
