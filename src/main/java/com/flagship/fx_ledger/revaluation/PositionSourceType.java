package com.flagship.fx_ledger.revaluation;

public enum PositionSourceType {
    INVOICE,
    BANK_ACCOUNT
}
