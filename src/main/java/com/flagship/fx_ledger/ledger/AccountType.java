package com.flagship.fx_ledger.ledger;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Chart-of-accounts classification.
 *
 * The type decides which side of the ledger increases the account:
 * ASSET and EXPENSE are debit-normal, LIABILITY, EQUITY and REVENUE are credit-normal.
 */
public enum AccountType {
    ASSET(true),
    LIABILITY(false),
    EQUITY(false),
    REVENUE(false),
    EXPENSE(true);

    private final boolean debitNormal;

    AccountType(boolean debitNormal) {
        this.debitNormal = debitNormal;
    }

    public boolean isDebitNormal() {
        return debitNormal;
    }

    /**
     * Net balance under this type's sign convention.
     * Used for both account totals and running ledger balances.
     */
    public BigDecimal net(BigDecimal debit, BigDecimal credit) {
        return debitNormal ? debit.subtract(credit) : credit.subtract(debit);
    }

    public boolean isBalanceSheetType() {
        return this == ASSET || this == LIABILITY || this == EQUITY;
    }

    /**
     * Parses the lower-case column value used by the store ("asset", "liability", ...).
     */
    public static AccountType fromColumn(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Account type is required");
        }
        return AccountType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String toColumn() {
        return name().toLowerCase(Locale.ROOT);
    }
}
