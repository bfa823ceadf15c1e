package com.flagship.fx_ledger.observability;

import org.slf4j.MDC;

import java.time.LocalDate;
import java.util.UUID;

/**
 * MDC bookkeeping for one report or rate-maintenance call.
 *
 * Every log line written while a report is built carries the correlation ID, the report type
 * and the as-of date, so warnings about missing rates or unbalanced entries can be traced
 * back to the request that produced them.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String REPORT_TYPE_MDC_KEY = "reportType";
    public static final String AS_OF_DATE_MDC_KEY = "asOfDate";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Opens a scope for one report. Keeps an existing correlation ID if the caller set one.
     * Close the returned scope to restore the MDC.
     */
    public static Scope open(String reportType, LocalDate asOfDate) {
        boolean ownsCorrelationId = MDC.get(CORRELATION_ID_MDC_KEY) == null;
        if (ownsCorrelationId) {
            MDC.put(CORRELATION_ID_MDC_KEY, generateCorrelationId());
        }
        MDC.put(REPORT_TYPE_MDC_KEY, reportType);
        MDC.put(AS_OF_DATE_MDC_KEY, asOfDate != null ? asOfDate.toString() : "none");
        return new Scope(ownsCorrelationId);
    }

    public static String getCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Generates a new correlation ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static final class Scope implements AutoCloseable {
        private final boolean ownsCorrelationId;

        private Scope(boolean ownsCorrelationId) {
            this.ownsCorrelationId = ownsCorrelationId;
        }

        @Override
        public void close() {
            MDC.remove(REPORT_TYPE_MDC_KEY);
            MDC.remove(AS_OF_DATE_MDC_KEY);
            if (ownsCorrelationId) {
                MDC.remove(CORRELATION_ID_MDC_KEY);
            }
        }
    }
}
