package com.flagship.fx_ledger.report;

import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.hierarchy.AccountHierarchyBuilder;
import com.flagship.fx_ledger.hierarchy.AccountNode;
import com.flagship.fx_ledger.hierarchy.AccountTree;
import com.flagship.fx_ledger.ledger.Account;
import com.flagship.fx_ledger.ledger.AccountBalance;
import com.flagship.fx_ledger.ledger.BalanceAggregator;
import com.flagship.fx_ledger.ledger.DataIntegrityWarning;
import com.flagship.fx_ledger.ledger.EntryBalanceValidator;
import com.flagship.fx_ledger.ledger.JournalLine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds the trial balance of all active accounts.
 *
 * Totals add every account's own reporting debit and credit once; parent rows do not repeat
 * their children's amounts. The trial balance is balanced when the totals differ by less than the tolerance.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrialBalanceBuilder {

    private final BalanceAggregator balanceAggregator;
    private final AccountHierarchyBuilder hierarchyBuilder;
    private final EntryBalanceValidator entryBalanceValidator;
    private final LedgerProperties properties;

    public TrialBalance build(LedgerSnapshot snapshot) {
        List<JournalLine> visible = snapshot.getLines().stream()
            .filter(line -> line.isVisibleAt(snapshot.getAsOfDate()))
            .toList();
        Map<String, AccountBalance> balances = balanceAggregator.aggregate(visible);
        AccountTree tree = hierarchyBuilder.buildTree(snapshot.getAccounts(), balances);

        List<DataIntegrityWarning> warnings = new ArrayList<>();
        warnings.addAll(entryBalanceValidator.validate(visible, properties.getTolerance()));
        warnings.addAll(tree.getWarnings());
        warnings.addAll(unknownAccounts(snapshot.getAccounts(), balances));

        List<TrialBalanceLine> lines = new ArrayList<>();
        BigDecimal totalDebits = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;
        for (AccountNode node : tree.flatten()) {
            Account account = node.getAccount();
            AccountBalance balance = node.getBalance();
            lines.add(new TrialBalanceLine(
                account.getCode(),
                account.getName(),
                account.getType(),
                node.getDepth(),
                balance.getReportingDebit(),
                balance.getReportingCredit(),
                node.getReportingNet()));
            totalDebits = totalDebits.add(balance.getReportingDebit());
            totalCredits = totalCredits.add(balance.getReportingCredit());
        }

        boolean balanced = totalDebits.subtract(totalCredits).abs().compareTo(properties.getTolerance()) < 0;
        if (!balanced) {
            log.warn("Trial balance does not balance: debits={}, credits={}", totalDebits, totalCredits);
        }
        return new TrialBalance(snapshot.getAsOfDate(), tree, lines, totalDebits, totalCredits, balanced, warnings);
    }

    private List<DataIntegrityWarning> unknownAccounts(List<Account> accounts, Map<String, AccountBalance> balances) {
        Set<String> known = accounts.stream().map(Account::getCode).collect(Collectors.toSet());
        List<DataIntegrityWarning> warnings = new ArrayList<>();
        new TreeMap<>(balances).forEach((code, balance) -> {
            if (!known.contains(code)) {
                log.warn("Posted lines reference an unknown or inactive account: code={}", code);
                warnings.add(DataIntegrityWarning.of(
                    DataIntegrityWarning.Type.UNKNOWN_ACCOUNT,
                    code,
                    String.format("Lines on unknown account left out of the report: debits=%s, credits=%s",
                        balance.getReportingDebit(), balance.getReportingCredit())));
            }
        });
        return warnings;
    }
}
