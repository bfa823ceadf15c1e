package com.flagship.fx_ledger.fx;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable in-memory set of rate rows, loaded once per report request.
 *
 * Selection: among active rows of the pair dated on or before the as-of date, the latest date wins;
 * rows sharing that date are ordered by sequence number and the highest wins.
 * The same currency on both sides always resolves to 1. Currency codes are matched case-insensitively.
 */
public final class RateTable implements RateSource {

    static final Comparator<FxRate> PRECEDENCE = Comparator
        .comparing(FxRate::getDate)
        .thenComparingLong(FxRate::getSequenceNumber)
        .reversed();

    private final Map<String, List<FxRate>> ratesByPair;

    private RateTable(Map<String, List<FxRate>> ratesByPair) {
        this.ratesByPair = ratesByPair;
    }

    public static RateTable of(Collection<FxRate> rates) {
        Map<String, List<FxRate>> byPair = new HashMap<>();
        for (FxRate rate : rates) {
            if (rate.isActive()) {
                byPair.computeIfAbsent(pairKey(rate.getFromCurrency(), rate.getToCurrency()), k -> new ArrayList<>())
                    .add(rate);
            }
        }
        Map<String, List<FxRate>> sorted = new HashMap<>();
        byPair.forEach((pair, list) -> {
            List<FxRate> copy = new ArrayList<>(list);
            copy.sort(PRECEDENCE);
            sorted.put(pair, List.copyOf(copy));
        });
        return new RateTable(Map.copyOf(sorted));
    }

    public static RateTable empty() {
        return new RateTable(Map.of());
    }

    /**
     * The row that governs the pair on the as-of date.
     */
    public Optional<FxRate> find(String fromCurrency, String toCurrency, LocalDate asOfDate) {
        List<FxRate> candidates = ratesByPair.getOrDefault(pairKey(fromCurrency, toCurrency), List.of());
        for (FxRate rate : candidates) {
            if (!rate.getDate().isAfter(asOfDate)) {
                return Optional.of(rate);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<BigDecimal> rateFor(String fromCurrency, String toCurrency, LocalDate asOfDate) {
        if (code(fromCurrency).equals(code(toCurrency))) {
            return Optional.of(BigDecimal.ONE);
        }
        return find(fromCurrency, toCurrency, asOfDate).map(FxRate::getRate);
    }

    public int size() {
        return ratesByPair.values().stream().mapToInt(List::size).sum();
    }

    private static String pairKey(String from, String to) {
        return code(from) + "/" + code(to);
    }

    // Unlike FxRate.normalizeCurrency this never throws; a malformed code just finds no rate.
    private static String code(String currency) {
        return currency == null ? "" : currency.trim().toUpperCase(Locale.ROOT);
    }
}
