package com.flagship.fx_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A single line of a journal entry, joined with the owning entry's date and status.
 *
 * Debit and credit are in the transaction currency and never negative.
 * Reporting amounts fall back to the transaction amounts when the store carries none,
 * which is the case for lines already booked in the reporting currency.
 */
@Value
public class JournalLine {
    UUID id;
    UUID entryId;
    LocalDate entryDate;
    JournalEntryStatus entryStatus;
    String entryDescription;
    String entryReference;
    String accountCode;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    BigDecimal reportingDebit;
    BigDecimal reportingCredit;
    String originalCurrency;
    BigDecimal fxRate;

    @Builder
    private JournalLine(UUID id, UUID entryId, LocalDate entryDate, JournalEntryStatus entryStatus,
                        String entryDescription, String entryReference, String accountCode,
                        BigDecimal debitAmount, BigDecimal creditAmount,
                        BigDecimal reportingDebit, BigDecimal reportingCredit,
                        String originalCurrency, BigDecimal fxRate) {
        this.id = id != null ? id : UUID.randomUUID();
        this.entryId = Objects.requireNonNull(entryId, "entryId");
        this.entryDate = Objects.requireNonNull(entryDate, "entryDate");
        this.entryStatus = entryStatus != null ? entryStatus : JournalEntryStatus.POSTED;
        this.entryDescription = entryDescription;
        this.entryReference = entryReference;
        this.accountCode = Objects.requireNonNull(accountCode, "accountCode");
        this.debitAmount = nonNegative(debitAmount, "debitAmount");
        this.creditAmount = nonNegative(creditAmount, "creditAmount");
        this.reportingDebit = reportingDebit != null ? nonNegative(reportingDebit, "reportingDebit") : this.debitAmount;
        this.reportingCredit = reportingCredit != null ? nonNegative(reportingCredit, "reportingCredit") : this.creditAmount;
        this.originalCurrency = originalCurrency;
        this.fxRate = fxRate;
    }

    /**
     * True when the line belongs to a posted entry dated on or before the cutoff.
     */
    public boolean isVisibleAt(LocalDate asOfDate) {
        return entryStatus == JournalEntryStatus.POSTED && !entryDate.isAfter(asOfDate);
    }

    private static BigDecimal nonNegative(BigDecimal amount, String field) {
        if (amount == null) {
            return BigDecimal.ZERO;
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + amount);
        }
        return amount;
    }
}
