package com.flagship.fx_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A sent, not fully settled customer invoice as read from the invoicing collaborator.
 * {@code historicalRate} is the booking-date rate and may be missing on old rows.
 */
@Value
@Builder
public class OpenInvoice {
    UUID id;
    String invoiceNumber;
    String customerName;
    boolean foreignCustomer;
    String currency;
    BigDecimal totalAmount;
    BigDecimal historicalRate;
    LocalDate invoiceDate;
    LocalDate dueDate;

    /**
     * Open balance in the invoice currency after the given allocations.
     */
    public BigDecimal remainingAfter(BigDecimal allocated) {
        return totalAmount.subtract(allocated != null ? allocated : BigDecimal.ZERO);
    }
}
