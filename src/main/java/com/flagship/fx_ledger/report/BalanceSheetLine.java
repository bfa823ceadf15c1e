package com.flagship.fx_ledger.report;

import com.flagship.fx_ledger.ledger.AccountType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Balance sheet row. {@code netBalance} sums transaction-currency amounts as booked;
 * {@code reportingNetBalance} is the figure that adds up across currencies.
 */
@Value
public class BalanceSheetLine {
    String accountCode;
    String accountName;
    AccountType accountType;
    int depth;
    BigDecimal netBalance;
    BigDecimal reportingNetBalance;
}
