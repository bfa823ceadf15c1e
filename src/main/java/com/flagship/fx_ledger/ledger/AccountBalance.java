package com.flagship.fx_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregated debit/credit totals of one account, in transaction and reporting currency.
 * Balances are derived from journal lines, never stored.
 */
@Value
public class AccountBalance {
    String accountCode;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal reportingDebit;
    BigDecimal reportingCredit;

    public static AccountBalance empty(String accountCode) {
        return new AccountBalance(accountCode, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public static AccountBalance of(JournalLine line) {
        return new AccountBalance(
            line.getAccountCode(),
            line.getDebitAmount(),
            line.getCreditAmount(),
            line.getReportingDebit(),
            line.getReportingCredit()
        );
    }

    /**
     * Combines two balances of the same account. Associative and commutative.
     */
    public AccountBalance merge(AccountBalance other) {
        if (!accountCode.equals(other.accountCode)) {
            throw new IllegalArgumentException(
                String.format("Cannot merge balances of %s and %s", accountCode, other.accountCode));
        }
        return new AccountBalance(
            accountCode,
            debit.add(other.debit),
            credit.add(other.credit),
            reportingDebit.add(other.reportingDebit),
            reportingCredit.add(other.reportingCredit)
        );
    }

    public BigDecimal netFor(AccountType type) {
        return type.net(debit, credit);
    }

    public BigDecimal reportingNetFor(AccountType type) {
        return type.net(reportingDebit, reportingCredit);
    }

    public boolean isZero() {
        return debit.signum() == 0 && credit.signum() == 0
            && reportingDebit.signum() == 0 && reportingCredit.signum() == 0;
    }
}
