package com.flagship.fx_ledger.report;

import java.time.LocalDate;

/**
 * Thrown when a report cannot be built because the ledger store failed.
 * Data quality problems never raise this; they become warnings on the report.
 */
public class ReportGenerationException extends RuntimeException {

    private final String reportType;
    private final LocalDate asOfDate;

    public ReportGenerationException(String reportType, LocalDate asOfDate, Throwable cause) {
        super(String.format("Failed to build %s as of %s: %s", reportType, asOfDate, cause.getMessage()), cause);
        this.reportType = reportType;
        this.asOfDate = asOfDate;
    }

    public String getReportType() {
        return reportType;
    }

    public LocalDate getAsOfDate() {
        return asOfDate;
    }
}
