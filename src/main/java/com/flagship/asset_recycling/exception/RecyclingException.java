package com.flagship.asset_recycling.exception;

/**
 * Base type for all failures raised by the registry, ledger and recycle pipeline.
 *
 * Unchecked, like the IllegalArgumentException/IllegalStateException pair the
 * services used before: callers decide where to translate, and the batch
 * coordinator is the only place that converts these into values.
 */
public abstract class RecyclingException extends RuntimeException {

    private final ErrorKind kind;

    protected RecyclingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RecyclingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Short, stable reason label, e.g. {@code "not owner"}.
     */
    public String getReason() {
        return kind.getLabel();
    }
}
