package com.flagship.fx_ledger.report;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One unpaid invoice. {@code appliedRate} is the rate used for {@code reportingAmount},
 * or null when the raw amount had to be used.
 */
@Value
@Builder
public class ArBreakdownItem {
    UUID invoiceId;
    String invoiceNumber;
    String customerName;
    String currency;
    BigDecimal totalAmount;
    BigDecimal allocatedAmount;
    BigDecimal remainingAmount;
    BigDecimal appliedRate;
    BigDecimal reportingAmount;
    LocalDate invoiceDate;
    LocalDate dueDate;
    long daysOverdue;
    ArStatus status;
}
