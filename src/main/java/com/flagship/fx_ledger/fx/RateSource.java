package com.flagship.fx_ledger.fx;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Lookup of a conversion rate valid on a date.
 */
@FunctionalInterface
public interface RateSource {

    /**
     * @return units of {@code toCurrency} per unit of {@code fromCurrency}, or empty when no rate is known
     */
    Optional<BigDecimal> rateFor(String fromCurrency, String toCurrency, LocalDate asOfDate);
}
