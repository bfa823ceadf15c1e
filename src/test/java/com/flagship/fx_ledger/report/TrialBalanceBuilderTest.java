package com.flagship.fx_ledger.report;

import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.hierarchy.AccountHierarchyBuilder;
import com.flagship.fx_ledger.ledger.Account;
import com.flagship.fx_ledger.ledger.AccountType;
import com.flagship.fx_ledger.ledger.BalanceAggregator;
import com.flagship.fx_ledger.ledger.DataIntegrityWarning;
import com.flagship.fx_ledger.ledger.EntryBalanceValidator;
import com.flagship.fx_ledger.ledger.JournalLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TrialBalanceBuilderTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 3, 31);

    private final TrialBalanceBuilder builder = new TrialBalanceBuilder(
        new BalanceAggregator(), new AccountHierarchyBuilder(), new EntryBalanceValidator(), new LedgerProperties());

    private final UUID assetsId = UUID.randomUUID();
    private final List<Account> accounts = List.of(
        Account.root(assetsId, "1000", "Assets", AccountType.ASSET),
        Account.child(UUID.randomUUID(), "1100", "Cash", AccountType.ASSET, assetsId),
        Account.root(UUID.randomUUID(), "2100", "Payables", AccountType.LIABILITY),
        Account.root(UUID.randomUUID(), "4100", "Sales", AccountType.REVENUE),
        Account.root(UUID.randomUUID(), "5100", "Rent", AccountType.EXPENSE));

    private static JournalLine line(UUID entryId, String account, String debit, String credit) {
        return JournalLine.builder()
            .entryId(entryId)
            .entryDate(AS_OF.minusDays(5))
            .accountCode(account)
            .debitAmount(new BigDecimal(debit))
            .creditAmount(new BigDecimal(credit))
            .build();
    }

    @Test
    @DisplayName("Balanced ledger gives equal totals, tree rows and no warnings")
    void testBalancedTrialBalance() {
        UUID sale = UUID.randomUUID();
        UUID rent = UUID.randomUUID();
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
            .asOfDate(AS_OF)
            .accounts(accounts)
            .lines(List.of(
                line(sale, "1100", "5000", "0"),
                line(sale, "4100", "0", "5000"),
                line(rent, "5100", "800", "0"),
                line(rent, "2100", "0", "800")))
            .build();

        TrialBalance report = builder.build(snapshot);

        assertTrue(report.isBalanced());
        assertEquals(0, new BigDecimal("5800").compareTo(report.getTotalDebits()));
        assertEquals(0, new BigDecimal("5800").compareTo(report.getTotalCredits()));
        assertEquals(5, report.getLines().size());
        assertEquals("1000", report.getLines().get(0).getAccountCode());
        assertEquals("1100", report.getLines().get(1).getAccountCode());
        assertEquals(1, report.getLines().get(1).getDepth());
        assertTrue(report.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("Parent rows do not repeat children's amounts in the totals")
    void testNoDoubleCounting() {
        UUID entry = UUID.randomUUID();
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
            .asOfDate(AS_OF)
            .accounts(accounts)
            .lines(List.of(line(entry, "1100", "100", "0"), line(entry, "4100", "0", "100")))
            .build();

        TrialBalance report = builder.build(snapshot);

        assertEquals(0, new BigDecimal("100").compareTo(report.getTotalDebits()));
        assertEquals(0, new BigDecimal("100").compareTo(
            report.getTree().find("1000").orElseThrow().rolledUpReportingNet()));
    }

    @Test
    @DisplayName("An unbalanced entry makes the trial balance unbalanced and is named")
    void testUnbalanced() {
        UUID entry = UUID.randomUUID();
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
            .asOfDate(AS_OF)
            .accounts(accounts)
            .lines(List.of(line(entry, "1100", "100", "0"), line(entry, "4100", "0", "99.98")))
            .build();

        TrialBalance report = builder.build(snapshot);

        assertFalse(report.isBalanced());
        assertEquals(0, new BigDecimal("0.02").compareTo(report.getDifference()));
        assertEquals(DataIntegrityWarning.Type.UNBALANCED_ENTRY, report.getWarnings().get(0).getType());
    }

    @Test
    @DisplayName("A difference under 0.01 still counts as balanced")
    void testWithinTolerance() {
        UUID entry = UUID.randomUUID();
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
            .asOfDate(AS_OF)
            .accounts(accounts)
            .lines(List.of(line(entry, "1100", "100.005", "0"), line(entry, "4100", "0", "100")))
            .build();

        assertTrue(builder.build(snapshot).isBalanced());
    }

    @Test
    @DisplayName("Lines on an unknown account raise UNKNOWN_ACCOUNT")
    void testUnknownAccount() {
        UUID entry = UUID.randomUUID();
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
            .asOfDate(AS_OF)
            .accounts(accounts)
            .lines(List.of(line(entry, "1100", "100", "0"), line(entry, "9999", "0", "100")))
            .build();

        TrialBalance report = builder.build(snapshot);

        assertTrue(report.getWarnings().stream()
            .anyMatch(w -> w.getType() == DataIntegrityWarning.Type.UNKNOWN_ACCOUNT && w.getSubject().equals("9999")));
    }

    @Test
    @DisplayName("Accounts without activity appear with zero balances")
    void testEmptyLedger() {
        TrialBalance report = builder.build(LedgerSnapshot.builder().asOfDate(AS_OF).accounts(accounts).build());

        assertEquals(5, report.getLines().size());
        assertTrue(report.isBalanced());
        assertEquals(0, BigDecimal.ZERO.compareTo(report.getTotalDebits()));
    }
}
