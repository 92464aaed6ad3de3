package com.flagship.asset_recycling.exception;

/**
 * Stable classification of every failure the recycling core can report.
 *
 * The label is what batch failure observations carry as their reason, so it
 * must not change once clients depend on it.
 */
public enum ErrorKind {
    VALIDATION("invalid input"),
    NOT_REGISTERED("not registered"),
    NOT_ACTIVE("not active"),
    ALREADY_REGISTERED("already registered"),
    CAPABILITY_MISSING("capability missing"),
    NOT_OWNER("not owner"),
    UNIT_NOT_FOUND("unit not found"),
    OPERATION_FAILED("operation failed"),
    POSTCONDITION_VIOLATED("postcondition violated"),
    PAUSED("paused"),
    UNAUTHORIZED("unauthorized"),
    REENTRANT_CALL("reentrant call"),
    UNEXPECTED("unexpected error");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
