package com.flagship.fx_ledger.ledger;

import lombok.Value;

/**
 * A recoverable data problem found while building a report.
 * Warnings are attached to the report instead of aborting it.
 */
@Value
public class DataIntegrityWarning {
    Type type;
    String subject;
    String message;

    public enum Type {
        UNBALANCED_ENTRY,
        ORPHAN_ACCOUNT,
        CYCLIC_PARENT,
        UNKNOWN_ACCOUNT
    }

    public static DataIntegrityWarning of(Type type, String subject, String message) {
        return new DataIntegrityWarning(type, subject, message);
    }
}
