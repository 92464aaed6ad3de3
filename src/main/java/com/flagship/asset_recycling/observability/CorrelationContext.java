package com.flagship.asset_recycling.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 *
 * The id flows from the HTTP header into every log line of the request,
 * including the lines written by batch items and outbox writes.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String ACTOR_HEADER = "X-Actor-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACTOR_MDC_KEY = "actor";
    public static final String CLASS_ID_MDC_KEY = "classId";
    public static final String UNIT_ID_MDC_KEY = "unitId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation id, generating one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
