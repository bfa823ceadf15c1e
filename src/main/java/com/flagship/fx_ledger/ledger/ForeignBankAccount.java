package com.flagship.fx_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Active bank account held in a currency other than the reporting currency.
 */
@Value
public class ForeignBankAccount {
    UUID id;
    String name;
    String currency;
    BigDecimal balance;
}
