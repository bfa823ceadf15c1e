package com.flagship.fx_ledger.revaluation;

/**
 * Where a position's historical rate comes from.
 */
public enum RateBasis {
    /**
     * Rate recorded when the item was booked. Gain or loss is real.
     */
    BOOKING_RATE,
    /**
     * No booking rate is kept for the item; the current rate stands in, so gain or loss is always zero.
     */
    REFERENCE_RATE
}
