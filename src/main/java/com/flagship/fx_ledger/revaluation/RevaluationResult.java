package com.flagship.fx_ledger.revaluation;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of revaluing open foreign-currency items on one date.
 *
 * Positions without a current rate stay in {@code positions} but are left out of
 * {@code totalGainLoss}; their currencies are listed in {@code missingCurrencies} (sorted).
 */
@Value
public class RevaluationResult {
    LocalDate asOfDate;
    List<ForeignPosition> positions;
    List<String> missingCurrencies;
    List<MissingRate> missingRates;
    BigDecimal totalGainLoss;

    public RevaluationResult(LocalDate asOfDate, List<ForeignPosition> positions, List<String> missingCurrencies,
                             List<MissingRate> missingRates, BigDecimal totalGainLoss) {
        this.asOfDate = asOfDate;
        this.positions = List.copyOf(positions);
        this.missingCurrencies = List.copyOf(missingCurrencies);
        this.missingRates = List.copyOf(missingRates);
        this.totalGainLoss = totalGainLoss;
    }

    public boolean hasMissingRates() {
        return !missingCurrencies.isEmpty();
    }

    public BigDecimal getTotalGains() {
        return positions.stream()
            .map(ForeignPosition::getGainLoss)
            .filter(g -> g != null && g.signum() > 0)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getTotalLosses() {
        return positions.stream()
            .map(ForeignPosition::getGainLoss)
            .filter(g -> g != null && g.signum() < 0)
            .map(BigDecimal::negate)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
