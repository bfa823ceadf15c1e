package com.flagship.fx_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Checks that every posted journal entry balances in both currencies.
 *
 * Unlike posting, where an imbalance is rejected outright, an imbalance found while reporting
 * means the store already holds corrupt data. The entry keeps counting in the totals and
 * an UNBALANCED_ENTRY warning names it.
 */
@Component
@Slf4j
public class EntryBalanceValidator {

    public List<DataIntegrityWarning> validate(Collection<JournalLine> lines, BigDecimal tolerance) {
        Map<UUID, EntryTotals> totalsByEntry = new LinkedHashMap<>();
        for (JournalLine line : lines) {
            totalsByEntry.computeIfAbsent(line.getEntryId(), id -> new EntryTotals(line)).add(line);
        }

        List<DataIntegrityWarning> warnings = new ArrayList<>();
        totalsByEntry.values().stream()
            .sorted(Comparator.comparing((EntryTotals t) -> t.entryDate).thenComparing(t -> t.entryId))
            .filter(totals -> !totals.isBalanced(tolerance))
            .forEach(totals -> {
                log.warn("Posted entry is not balanced: entryId={}, debits={}, credits={}, reportingDebits={}, reportingCredits={}",
                    totals.entryId, totals.debit, totals.credit, totals.reportingDebit, totals.reportingCredit);
                warnings.add(DataIntegrityWarning.of(
                    DataIntegrityWarning.Type.UNBALANCED_ENTRY,
                    totals.label(),
                    String.format("Entry is not balanced: debits=%s, credits=%s, reporting debits=%s, reporting credits=%s",
                        totals.debit, totals.credit, totals.reportingDebit, totals.reportingCredit)));
            });
        return warnings;
    }

    private static final class EntryTotals {
        private final UUID entryId;
        private final String reference;
        private final LocalDate entryDate;
        private BigDecimal debit = BigDecimal.ZERO;
        private BigDecimal credit = BigDecimal.ZERO;
        private BigDecimal reportingDebit = BigDecimal.ZERO;
        private BigDecimal reportingCredit = BigDecimal.ZERO;

        private EntryTotals(JournalLine first) {
            this.entryId = first.getEntryId();
            this.reference = first.getEntryReference();
            this.entryDate = first.getEntryDate();
        }

        private void add(JournalLine line) {
            debit = debit.add(line.getDebitAmount());
            credit = credit.add(line.getCreditAmount());
            reportingDebit = reportingDebit.add(line.getReportingDebit());
            reportingCredit = reportingCredit.add(line.getReportingCredit());
        }

        private boolean isBalanced(BigDecimal tolerance) {
            return debit.subtract(credit).abs().compareTo(tolerance) < 0
                && reportingDebit.subtract(reportingCredit).abs().compareTo(tolerance) < 0;
        }

        private String label() {
            return reference != null ? entryId + " (" + reference + ")" : entryId.toString();
        }
    }
}
