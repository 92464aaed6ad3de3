package com.flagship.asset_recycling.exception;

/**
 * Malformed input: blank identifiers, out-of-range rates, bad batch shapes.
 */
public class ValidationException extends RecyclingException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
