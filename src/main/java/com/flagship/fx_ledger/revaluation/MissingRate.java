package com.flagship.fx_ledger.revaluation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A currency with open positions but no resolvable rate, with how much is left unvalued.
 */
@Value
public class MissingRate {
    String currency;
    int positionsCount;
    BigDecimal totalAmount;
}
