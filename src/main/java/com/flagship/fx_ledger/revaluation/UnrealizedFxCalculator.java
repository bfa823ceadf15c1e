package com.flagship.fx_ledger.revaluation;

import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.fx.RateSource;
import com.flagship.fx_ledger.ledger.ForeignBankAccount;
import com.flagship.fx_ledger.ledger.OpenInvoice;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Values open foreign-currency items at the as-of date rate.
 *
 * Invoices: remaining = total − allocations, kept when above the tolerance, valued against the booking rate.
 * Bank balances: kept when above the tolerance. No booking rate is stored for them, so the current
 * rate is used as reference and their gain/loss is zero; they are listed for exposure only.
 *
 * A currency without a rate does not fail the run. Its positions are kept with no current rate,
 * are left out of the total, and the currency is reported as missing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UnrealizedFxCalculator {

    private final LedgerProperties properties;

    public RevaluationResult computePositions(OpenItems openItems, RateSource rates, LocalDate asOfDate) {
        if (asOfDate == null) {
            throw new IllegalArgumentException("As-of date is required");
        }
        String reportingCurrency = properties.getReportingCurrency();
        BigDecimal tolerance = properties.getTolerance();
        LedgerProperties.Revaluation accounts = properties.getRevaluation();

        List<ForeignPosition> positions = new ArrayList<>();
        for (OpenInvoice invoice : openItems.getInvoices()) {
            if (reportingCurrency.equals(invoice.getCurrency())) {
                continue;
            }
            BigDecimal remaining = invoice.remainingAfter(openItems.allocatedTo(invoice.getId()));
            if (remaining.compareTo(tolerance) <= 0) {
                continue;
            }
            positions.add(ForeignPosition.builder()
                .sourceId(invoice.getId())
                .sourceType(PositionSourceType.INVOICE)
                .sourceReference(invoice.getInvoiceNumber())
                .currency(invoice.getCurrency())
                .remainingAmount(remaining)
                .historicalRate(invoice.getHistoricalRate())
                .currentRate(rates.rateFor(invoice.getCurrency(), reportingCurrency, asOfDate).orElse(null))
                .rateBasis(RateBasis.BOOKING_RATE)
                .asOfDate(asOfDate)
                .accountCode(accounts.getReceivableAccountCode())
                .accountName(accounts.getReceivableAccountName())
                .build());
        }

        for (ForeignBankAccount bank : openItems.getBankAccounts()) {
            if (reportingCurrency.equals(bank.getCurrency()) || bank.getBalance().compareTo(tolerance) <= 0) {
                continue;
            }
            BigDecimal current = rates.rateFor(bank.getCurrency(), reportingCurrency, asOfDate).orElse(null);
            positions.add(ForeignPosition.builder()
                .sourceId(bank.getId())
                .sourceType(PositionSourceType.BANK_ACCOUNT)
                .sourceReference(bank.getName())
                .currency(bank.getCurrency())
                .remainingAmount(bank.getBalance())
                .historicalRate(current)
                .currentRate(current)
                .rateBasis(RateBasis.REFERENCE_RATE)
                .asOfDate(asOfDate)
                .accountCode(accounts.getBankAccountCode())
                .accountName(accounts.getBankAccountName())
                .build());
        }

        Map<String, MissingTally> missing = new TreeMap<>();
        BigDecimal total = BigDecimal.ZERO;
        for (ForeignPosition position : positions) {
            if (!position.hasCurrentRate()) {
                missing.computeIfAbsent(position.getCurrency(), c -> new MissingTally()).add(position.getRemainingAmount());
                continue;
            }
            BigDecimal gainLoss = position.getGainLoss();
            if (gainLoss != null) {
                total = total.add(gainLoss);
            }
        }

        List<MissingRate> missingRates = new ArrayList<>();
        missing.forEach((currency, tally) -> {
            log.warn("No exchange rate for {}/{} on or before {}: positions={}, amount={}",
                currency, reportingCurrency, asOfDate, tally.count, tally.amount);
            missingRates.add(new MissingRate(currency, tally.count, tally.amount));
        });

        log.debug("Revaluation computed: positions={}, missingCurrencies={}, totalGainLoss={}",
            positions.size(), missing.keySet(), total);
        return new RevaluationResult(asOfDate, positions, new ArrayList<>(missing.keySet()), missingRates, total);
    }

    private static final class MissingTally {
        private int count;
        private BigDecimal amount = BigDecimal.ZERO;

        private void add(BigDecimal remaining) {
            count++;
            amount = amount.add(remaining);
        }
    }
}
