package com.flagship.fx_ledger.report;

import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.fx.RateSource;
import com.flagship.fx_ledger.ledger.OpenInvoice;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists unpaid invoices of every currency with status and ageing.
 *
 * Status: Partially Paid when anything is allocated, otherwise Overdue once the due date has passed,
 * otherwise Open. Days overdue never go below zero. Invoices already in the reporting currency are
 * taken at face value. Others use the booking rate, then the as-of rate, and fall back to the raw
 * amount when neither is known.
 */
@Component
@RequiredArgsConstructor
public class ArBreakdownBuilder {

    private final LedgerProperties properties;

    public ArBreakdown build(LedgerSnapshot snapshot) {
        LocalDate asOfDate = snapshot.getAsOfDate();
        String reportingCurrency = properties.getReportingCurrency();

        List<ArBreakdownItem> items = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (OpenInvoice invoice : snapshot.getInvoices()) {
            BigDecimal allocated = snapshot.getAllocations().getOrDefault(invoice.getId(), BigDecimal.ZERO);
            BigDecimal remaining = invoice.remainingAfter(allocated);
            if (remaining.compareTo(properties.getTolerance()) <= 0) {
                continue;
            }

            BigDecimal rate = reportingRate(invoice, snapshot.getRates(), reportingCurrency, asOfDate);
            BigDecimal reportingAmount = rate != null ? remaining.multiply(rate) : remaining;
            long daysOverdue = daysOverdue(invoice.getDueDate(), asOfDate);

            items.add(ArBreakdownItem.builder()
                .invoiceId(invoice.getId())
                .invoiceNumber(invoice.getInvoiceNumber())
                .customerName(invoice.getCustomerName())
                .currency(invoice.getCurrency())
                .totalAmount(invoice.getTotalAmount())
                .allocatedAmount(allocated)
                .remainingAmount(remaining)
                .appliedRate(rate)
                .reportingAmount(reportingAmount)
                .invoiceDate(invoice.getInvoiceDate())
                .dueDate(invoice.getDueDate())
                .daysOverdue(daysOverdue)
                .status(statusOf(allocated, invoice.getDueDate(), asOfDate))
                .build());
            total = total.add(reportingAmount);
        }
        return new ArBreakdown(asOfDate, reportingCurrency, items, total);
    }

    static ArStatus statusOf(BigDecimal allocated, LocalDate dueDate, LocalDate asOfDate) {
        if (allocated.signum() > 0) {
            return ArStatus.PARTIALLY_PAID;
        }
        if (dueDate != null && asOfDate.isAfter(dueDate)) {
            return ArStatus.OVERDUE;
        }
        return ArStatus.OPEN;
    }

    static long daysOverdue(LocalDate dueDate, LocalDate asOfDate) {
        if (dueDate == null) {
            return 0;
        }
        return Math.max(0, ChronoUnit.DAYS.between(dueDate, asOfDate));
    }

    private static BigDecimal reportingRate(OpenInvoice invoice, RateSource rates, String reportingCurrency,
                                            LocalDate asOfDate) {
        if (reportingCurrency.equalsIgnoreCase(invoice.getCurrency())) {
            return BigDecimal.ONE;
        }
        if (invoice.getHistoricalRate() != null) {
            return invoice.getHistoricalRate();
        }
        return rates.rateFor(invoice.getCurrency(), reportingCurrency, asOfDate).orElse(null);
    }
}
