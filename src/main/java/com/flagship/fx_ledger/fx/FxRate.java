package com.flagship.fx_ledger.fx;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

/**
 * Domain model for an exchange rate row: 1 unit of {@code fromCurrency} = {@code rate} units of {@code toCurrency}.
 *
 * {@code sequenceNumber} is assigned by the store at insert time and orders rows that share a date.
 */
@Value
@Builder(toBuilder = true)
public class FxRate {

    public static final String MANUAL_SOURCE = "manual";

    UUID id;
    String fromCurrency;
    String toCurrency;
    LocalDate date;
    BigDecimal rate;
    String source;
    boolean active;
    String notes;
    Instant createdAt;
    long sequenceNumber;

    /**
     * Creates a new active manual rate, not yet stored.
     */
    public static FxRate manual(String fromCurrency, String toCurrency, BigDecimal rate, LocalDate date, String notes) {
        String from = normalizeCurrency(fromCurrency);
        String to = normalizeCurrency(toCurrency);
        if (from.equals(to)) {
            throw new IllegalArgumentException("Manual rate needs two different currencies: " + from);
        }
        if (date == null) {
            throw new IllegalArgumentException("Rate date is required");
        }
        if (rate == null || rate.signum() <= 0) {
            throw new IllegalArgumentException("Rate must be positive: " + rate);
        }
        return FxRate.builder()
            .id(UUID.randomUUID())
            .fromCurrency(from)
            .toCurrency(to)
            .date(date)
            .rate(rate)
            .source(MANUAL_SOURCE)
            .active(true)
            .notes(notes)
            .createdAt(Instant.now())
            .build();
    }

    /**
     * Upper-cases and validates an ISO-4217 style three-letter code.
     */
    public static String normalizeCurrency(String currency) {
        if (currency == null) {
            throw new IllegalArgumentException("Currency code is required");
        }
        String code = currency.trim().toUpperCase(Locale.ROOT);
        if (!code.matches("[A-Z]{3}")) {
            throw new IllegalArgumentException("Invalid currency code: " + currency);
        }
        return code;
    }
}
