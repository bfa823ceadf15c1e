package com.flagship.fx_ledger.report;

import com.flagship.fx_ledger.ledger.AccountType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One account row of the trial balance, own balance only, in reporting currency.
 */
@Value
public class TrialBalanceLine {
    String accountCode;
    String accountName;
    AccountType accountType;
    int depth;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal netBalance;
}
