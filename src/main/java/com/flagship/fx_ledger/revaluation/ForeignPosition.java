package com.flagship.fx_ledger.revaluation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An open foreign-currency amount valued at its historical and current rate.
 *
 * Reporting values and gain/loss are derived on read and are {@code null} when a needed rate is unknown.
 * A positive gain/loss is a gain.
 */
@Value
@Builder
public class ForeignPosition {
    UUID sourceId;
    PositionSourceType sourceType;
    String sourceReference;
    String currency;
    BigDecimal remainingAmount;
    BigDecimal historicalRate;
    BigDecimal currentRate;
    RateBasis rateBasis;
    LocalDate asOfDate;
    String accountCode;
    String accountName;

    public boolean hasCurrentRate() {
        return currentRate != null;
    }

    public BigDecimal getHistoricalReportingValue() {
        return historicalRate != null ? remainingAmount.multiply(historicalRate) : null;
    }

    public BigDecimal getCurrentReportingValue() {
        return currentRate != null ? remainingAmount.multiply(currentRate) : null;
    }

    /**
     * {@code remainingAmount × (currentRate − historicalRate)}, or null when either rate is unknown.
     */
    public BigDecimal getGainLoss() {
        if (currentRate == null || historicalRate == null) {
            return null;
        }
        return remainingAmount.multiply(currentRate.subtract(historicalRate));
    }
}
