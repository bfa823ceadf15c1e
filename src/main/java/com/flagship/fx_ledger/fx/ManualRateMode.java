package com.flagship.fx_ledger.fx;

/**
 * How a manual rate treats active rows already stored for the same pair and date.
 */
public enum ManualRateMode {
    /**
     * Keep earlier rows; the newest insert wins through the sequence tie-break.
     */
    APPEND,
    /**
     * Deactivate earlier same-day rows of the pair before inserting.
     */
    SUPERSEDE
}
