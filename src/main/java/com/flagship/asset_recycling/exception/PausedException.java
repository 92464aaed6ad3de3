package com.flagship.asset_recycling.exception;

public class PausedException extends RecyclingException {

    public PausedException(String message) {
        super(ErrorKind.PAUSED, message);
    }
}
