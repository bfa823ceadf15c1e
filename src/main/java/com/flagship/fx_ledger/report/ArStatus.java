package com.flagship.fx_ledger.report;

public enum ArStatus {
    PARTIALLY_PAID("Partially Paid"),
    OVERDUE("Overdue"),
    OPEN("Open");

    private final String label;

    ArStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
