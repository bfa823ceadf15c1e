package com.flagship.fx_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One row of an account's ledger with the balance carried forward after it.
 */
@Value
public class AccountLedgerLine {
    UUID lineId;
    UUID entryId;
    LocalDate date;
    String description;
    String reference;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal runningBalance;
}
