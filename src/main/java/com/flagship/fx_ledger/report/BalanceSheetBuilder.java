package com.flagship.fx_ledger.report;

import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.hierarchy.AccountHierarchyBuilder;
import com.flagship.fx_ledger.hierarchy.AccountNode;
import com.flagship.fx_ledger.hierarchy.AccountTree;
import com.flagship.fx_ledger.ledger.Account;
import com.flagship.fx_ledger.ledger.AccountBalance;
import com.flagship.fx_ledger.ledger.AccountType;
import com.flagship.fx_ledger.ledger.BalanceAggregator;
import com.flagship.fx_ledger.ledger.DataIntegrityWarning;
import com.flagship.fx_ledger.ledger.EntryBalanceValidator;
import com.flagship.fx_ledger.ledger.JournalLine;
import com.flagship.fx_ledger.revaluation.RevaluationResult;
import com.flagship.fx_ledger.revaluation.UnrealizedFxCalculator;
import com.flagship.fx_ledger.revaluation.VirtualJournalEntry;
import com.flagship.fx_ledger.revaluation.VirtualJournalGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class BalanceSheetBuilder {

    private final BalanceAggregator balanceAggregator;
    private final AccountHierarchyBuilder hierarchyBuilder;
    private final EntryBalanceValidator entryBalanceValidator;
    private final UnrealizedFxCalculator unrealizedFxCalculator;
    private final VirtualJournalGenerator virtualJournalGenerator;
    private final LedgerProperties properties;

    public BalanceSheet build(LedgerSnapshot snapshot) {
        List<JournalLine> visible = snapshot.getLines().stream()
            .filter(line -> line.isVisibleAt(snapshot.getAsOfDate()))
            .toList();
        Map<String, AccountBalance> balances = balanceAggregator.aggregate(visible);
        List<Account> balanceSheetAccounts = snapshot.getAccounts().stream()
            .filter(account -> account.getType().isBalanceSheetType())
            .toList();
        AccountTree tree = hierarchyBuilder.buildTree(balanceSheetAccounts, balances);

        Map<AccountType, List<BalanceSheetLine>> buckets = new EnumMap<>(AccountType.class);
        Map<AccountType, BigDecimal> totals = new EnumMap<>(AccountType.class);
        for (AccountType type : List.of(AccountType.ASSET, AccountType.LIABILITY, AccountType.EQUITY)) {
            buckets.put(type, new ArrayList<>());
            totals.put(type, BigDecimal.ZERO);
        }
        for (AccountNode node : tree.flatten()) {
            Account account = node.getAccount();
            AccountType type = account.getType();
            BigDecimal reportingNet = node.getReportingNet();
            buckets.get(type).add(new BalanceSheetLine(
                account.getCode(),
                account.getName(),
                type,
                node.getDepth(),
                node.getBalance().netFor(type),
                reportingNet));
            totals.merge(type, reportingNet, BigDecimal::add);
        }

        RevaluationResult revaluation = unrealizedFxCalculator.computePositions(
            snapshot.openForeignItems(properties.getReportingCurrency()), snapshot.getRates(), snapshot.getAsOfDate());
        VirtualJournalEntry entry = virtualJournalGenerator.generate(revaluation.getPositions(), snapshot.getAsOfDate());

        List<DataIntegrityWarning> warnings = new ArrayList<>();
        warnings.addAll(entryBalanceValidator.validate(visible, properties.getTolerance()));
        warnings.addAll(tree.getWarnings());

        return new BalanceSheet(
            snapshot.getAsOfDate(),
            buckets.get(AccountType.ASSET),
            buckets.get(AccountType.LIABILITY),
            buckets.get(AccountType.EQUITY),
            totals.get(AccountType.ASSET),
            totals.get(AccountType.LIABILITY),
            totals.get(AccountType.EQUITY),
            revaluation,
            entry,
            warnings);
    }
}
