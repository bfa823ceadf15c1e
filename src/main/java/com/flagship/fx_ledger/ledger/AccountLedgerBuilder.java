package com.flagship.fx_ledger.ledger;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the chronological ledger of one account in reporting currency.
 * The running balance follows the same sign convention as the aggregated net balance,
 * so the last running balance equals the account's net in the trial balance.
 */
@Component
public class AccountLedgerBuilder {

    public List<AccountLedgerLine> build(Account account, Collection<JournalLine> lines, LocalDate asOfDate) {
        List<JournalLine> ordered = lines.stream()
            .filter(line -> line.getAccountCode().equals(account.getCode()))
            .filter(line -> line.isVisibleAt(asOfDate))
            .sorted(Comparator.comparing(JournalLine::getEntryDate))
            .toList();

        List<AccountLedgerLine> ledger = new ArrayList<>(ordered.size());
        BigDecimal running = BigDecimal.ZERO;
        for (JournalLine line : ordered) {
            running = running.add(account.getType().net(line.getReportingDebit(), line.getReportingCredit()));
            ledger.add(new AccountLedgerLine(
                line.getId(),
                line.getEntryId(),
                line.getEntryDate(),
                line.getEntryDescription(),
                line.getEntryReference(),
                line.getReportingDebit(),
                line.getReportingCredit(),
                running
            ));
        }
        return ledger;
    }
}
