package com.flagship.asset_recycling.exception;

public class AuthorizationException extends RecyclingException {

    public AuthorizationException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
