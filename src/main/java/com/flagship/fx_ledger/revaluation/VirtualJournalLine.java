package com.flagship.fx_ledger.revaluation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One proposed journal line. Exactly one of debit and credit is non-zero.
 * {@code fxImpact} is the signed gain (+) or loss (−) the line stands for.
 */
@Value
public class VirtualJournalLine {
    String accountCode;
    String accountName;
    BigDecimal debit;
    BigDecimal credit;
    String description;
    String currency;
    BigDecimal fxImpact;

    public static VirtualJournalLine debit(String accountCode, String accountName, BigDecimal amount,
                                           String description, String currency, BigDecimal fxImpact) {
        return new VirtualJournalLine(accountCode, accountName, amount, BigDecimal.ZERO, description, currency, fxImpact);
    }

    public static VirtualJournalLine credit(String accountCode, String accountName, BigDecimal amount,
                                            String description, String currency, BigDecimal fxImpact) {
        return new VirtualJournalLine(accountCode, accountName, BigDecimal.ZERO, amount, description, currency, fxImpact);
    }
}
