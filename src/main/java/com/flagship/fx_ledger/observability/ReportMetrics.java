package com.flagship.fx_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for report generation and rate maintenance.
 *
 * Metrics exposed:
 * - ledger.report.generated: Counter of reports, tagged by type and outcome
 * - ledger.report.duration: Timer per report type
 * - ledger.fx.missing_rate: Counter of currencies left without a rate, tagged by currency
 * - ledger.integrity.warning: Counter of data integrity warnings, tagged by type
 * - ledger.fx.manual_rate: Counter of manual rates entered, tagged by mode
 */
@Component
public class ReportMetrics {

    private final MeterRegistry registry;

    private final Counter manualRatesApplied;
    private final Counter ratesDeactivated;

    public ReportMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.manualRatesApplied = Counter.builder("ledger.fx.manual_rate.total")
                .description("Number of manual exchange rates entered")
                .register(registry);

        this.ratesDeactivated = Counter.builder("ledger.fx.deactivated")
                .description("Number of exchange rate rows deactivated")
                .register(registry);
    }

    // ==================== Report Methods ====================

    /**
     * Records a finished report with its outcome ("success" or "failure").
     */
    public void recordReport(String reportType, String outcome, Duration duration) {
        registry.counter("ledger.report.generated",
                "report", sanitizeTag(reportType),
                "outcome", sanitizeTag(outcome)
        ).increment();

        Timer.builder("ledger.report.duration")
                .description("Time taken to build a report")
                .tag("report", sanitizeTag(reportType))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    // ==================== Data Quality Methods ====================

    public void recordMissingRate(String currency) {
        registry.counter("ledger.fx.missing_rate", "currency", sanitizeTag(currency)).increment();
    }

    public void recordIntegrityWarning(String warningType) {
        registry.counter("ledger.integrity.warning", "type", sanitizeTag(warningType)).increment();
    }

    // ==================== Rate Maintenance Methods ====================

    public void recordManualRate(String mode) {
        manualRatesApplied.increment();
        registry.counter("ledger.fx.manual_rate", "mode", sanitizeTag(mode)).increment();
    }

    public void recordRatesDeactivated(int count) {
        ratesDeactivated.increment(count);
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to keep cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
