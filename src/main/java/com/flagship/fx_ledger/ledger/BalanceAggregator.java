package com.flagship.fx_ledger.ledger;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Folds journal lines into per-account balances.
 *
 * The fold is pure and order independent: the result depends only on the multiset of lines.
 * Accounts whose lines net to zero stay in the map; hiding them is a presentation decision.
 */
@Component
public class BalanceAggregator {

    /**
     * Aggregates the given lines as-is. Callers pass lines already bounded by the as-of date.
     *
     * @param lines journal lines, any order
     * @return balance per account code
     */
    public Map<String, AccountBalance> aggregate(Collection<JournalLine> lines) {
        Map<String, AccountBalance> balances = new HashMap<>();
        for (JournalLine line : lines) {
            balances.merge(line.getAccountCode(), AccountBalance.of(line), AccountBalance::merge);
        }
        return balances;
    }

    /**
     * Aggregates only posted lines dated on or before {@code asOfDate}.
     */
    public Map<String, AccountBalance> aggregateVisible(Collection<JournalLine> lines, LocalDate asOfDate) {
        List<JournalLine> visible = lines.stream()
            .filter(line -> line.isVisibleAt(asOfDate))
            .collect(Collectors.toList());
        return aggregate(visible);
    }

    /**
     * Balance for one account, or an all-zero balance when it has no lines.
     */
    public static AccountBalance balanceOf(Map<String, AccountBalance> balances, String accountCode) {
        AccountBalance balance = balances.get(accountCode);
        return balance != null ? balance : AccountBalance.empty(accountCode);
    }
}
