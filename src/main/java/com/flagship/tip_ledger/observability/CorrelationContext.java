package com.flagship.tip_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id and MDC keys shared by the HTTP filter, the Kafka consumer
 * and the posting services.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String EMPLOYEE_ID_MDC_KEY = "employeeId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";
    public static final String POOL_ID_MDC_KEY = "poolId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Sets the id on this thread and in the MDC; a blank id is replaced by a fresh one.
     */
    public static void begin(String id) {
        String value = id != null && !id.isBlank() ? id : generateCorrelationId();
        correlationId.set(value);
        MDC.put(CORRELATION_ID_MDC_KEY, value);
    }

    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(EMPLOYEE_ID_MDC_KEY);
        MDC.remove(PAYMENT_ID_MDC_KEY);
        MDC.remove(POOL_ID_MDC_KEY);
    }

    /**
     * Short form for readable log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts a key in the MDC for the lifetime of the returned handle.
     */
    public static MDC.MDCCloseable scoped(String key, Object value) {
        return MDC.putCloseable(key, String.valueOf(value));
    }
}
