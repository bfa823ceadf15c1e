package com.flagship.fx_ledger.report;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
public class ArBreakdown {
    LocalDate asOfDate;
    String reportingCurrency;
    List<ArBreakdownItem> items;
    BigDecimal totalReportingAmount;

    public long countByStatus(ArStatus status) {
        return items.stream().filter(item -> item.getStatus() == status).count();
    }

    public BigDecimal totalReportingByStatus(ArStatus status) {
        return items.stream()
            .filter(item -> item.getStatus() == status)
            .map(ArBreakdownItem::getReportingAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
