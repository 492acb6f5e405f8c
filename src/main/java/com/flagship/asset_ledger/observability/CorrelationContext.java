package com.flagship.asset_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys and helpers for request correlation.
 *
 * The correlation ID flows through:
 * - HTTP requests (from header or generated)
 * - All log statements (via MDC)
 * - Published Kafka events (as a header)
 *
 * Record IDs (asset, order) are added to the MDC for the duration of the
 * operation that touches them.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ASSET_ID_MDC_KEY = "assetId";
    public static final String ORDER_ID_MDC_KEY = "orderId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates and installs a new one if not set.
     */
    public static String getCorrelationId() {
        String id = MDC.get(CORRELATION_ID_MDC_KEY);
        if (id == null) {
            id = generateCorrelationId();
            MDC.put(CORRELATION_ID_MDC_KEY, id);
        }
        return id;
    }

    /**
     * Sets the correlation ID for the current thread, generating one for blank input.
     */
    public static void setCorrelationId(String id) {
        MDC.put(CORRELATION_ID_MDC_KEY, id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    /**
     * Removes the correlation ID and any record IDs from the current thread.
     */
    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(ASSET_ID_MDC_KEY);
        MDC.remove(ORDER_ID_MDC_KEY);
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
