package com.flagship.fx_ledger.report;

import com.flagship.fx_ledger.ledger.Account;
import com.flagship.fx_ledger.ledger.AccountLedgerLine;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
public class AccountLedger {
    Account account;
    LocalDate asOfDate;
    List<AccountLedgerLine> lines;

    /**
     * Running balance after the last line, zero for an account with no activity.
     */
    public BigDecimal getClosingBalance() {
        return lines.isEmpty() ? BigDecimal.ZERO : lines.get(lines.size() - 1).getRunningBalance();
    }
}
