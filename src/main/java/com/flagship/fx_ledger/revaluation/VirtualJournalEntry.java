package com.flagship.fx_ledger.revaluation;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * The revaluation entry that would be booked on the as-of date. Shown on reports, never posted.
 */
@Value
public class VirtualJournalEntry {
    LocalDate asOfDate;
    List<VirtualJournalLine> lines;

    public VirtualJournalEntry(LocalDate asOfDate, List<VirtualJournalLine> lines) {
        this.asOfDate = asOfDate;
        this.lines = List.copyOf(lines);
    }

    public BigDecimal getTotalDebit() {
        return lines.stream().map(VirtualJournalLine::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getTotalCredit() {
        return lines.stream().map(VirtualJournalLine::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isBalanced() {
        return getTotalDebit().compareTo(getTotalCredit()) == 0;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
