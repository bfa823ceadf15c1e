package com.flagship.fx_ledger.ledger;

import java.util.Locale;

/**
 * Lifecycle of a journal entry. Only POSTED entries reach balance computation.
 */
public enum JournalEntryStatus {
    DRAFT,
    POSTED;

    public static JournalEntryStatus fromColumn(String value) {
        return JournalEntryStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String toColumn() {
        return name().toLowerCase(Locale.ROOT);
    }
}
