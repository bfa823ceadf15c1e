package com.flagship.fx_ledger.hierarchy;

import com.flagship.fx_ledger.ledger.Account;
import com.flagship.fx_ledger.ledger.AccountBalance;
import com.flagship.fx_ledger.ledger.AccountType;
import com.flagship.fx_ledger.ledger.DataIntegrityWarning;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tree assembly by parent id, including the broken-data cases: orphans and cycles.
 */
class AccountHierarchyBuilderTest {

    private final AccountHierarchyBuilder builder = new AccountHierarchyBuilder();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static Account account(UUID id, String code, UUID parentId) {
        return new Account(id, code, "Account " + code, AccountType.ASSET, parentId, parentId == null ? 1 : 2, true);
    }

    private static AccountBalance balance(String code, String debit, String credit) {
        return new AccountBalance(code, new BigDecimal(debit), new BigDecimal(credit),
            new BigDecimal(debit), new BigDecimal(credit));
    }

    @Test
    @DisplayName("Children attach to the parent whose id they reference, ordered by code")
    void testChildrenAttachByParentId() {
        printTestHeader("Children attach by parent id");

        UUID assets = UUID.randomUUID();
        UUID cash = UUID.randomUUID();
        UUID receivables = UUID.randomUUID();
        UUID bank = UUID.randomUUID();
        List<Account> accounts = List.of(
            account(receivables, "1400", assets),
            account(bank, "1200", assets),
            account(assets, "1000", null),
            account(cash, "1100", assets));

        AccountTree tree = builder.buildTree(accounts, Map.of());

        assertEquals(1, tree.getRoots().size());
        AccountNode root = tree.getRoots().get(0);
        assertEquals("1000", root.getAccount().getCode());
        assertEquals(List.of("1100", "1200", "1400"),
            root.getChildren().stream().map(node -> node.getAccount().getCode()).toList());
        assertTrue(tree.getWarnings().isEmpty());
        printSuccess("All three children under 1000");
    }

    @Test
    @DisplayName("Siblings are not nested under each other because they share a parent")
    void testSiblingsStaySiblings() {
        UUID parent = UUID.randomUUID();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        UUID grandchild = UUID.randomUUID();
        List<Account> accounts = List.of(
            account(parent, "2000", null),
            account(first, "2100", parent),
            account(second, "2200", parent),
            account(grandchild, "2110", first));

        AccountTree tree = builder.buildTree(accounts, Map.of());

        AccountNode root = tree.getRoots().get(0);
        assertEquals(2, root.getChildren().size());
        AccountNode node2100 = root.getChildren().get(0);
        AccountNode node2200 = root.getChildren().get(1);
        assertEquals(List.of("2110"), node2100.getChildren().stream().map(n -> n.getAccount().getCode()).toList());
        assertTrue(node2200.isLeaf());
        assertEquals(2, node2100.getChildren().get(0).getDepth());
    }

    @Test
    @DisplayName("Unresolved parent makes the account a root with an ORPHAN_ACCOUNT warning")
    void testOrphan() {
        UUID root = UUID.randomUUID();
        UUID orphan = UUID.randomUUID();
        List<Account> accounts = List.of(
            account(root, "1000", null),
            account(orphan, "1500", UUID.randomUUID()));

        AccountTree tree = builder.buildTree(accounts, Map.of());

        assertEquals(List.of("1000", "1500"),
            tree.getRoots().stream().map(node -> node.getAccount().getCode()).toList());
        assertEquals(1, tree.getWarnings().size());
        assertEquals(DataIntegrityWarning.Type.ORPHAN_ACCOUNT, tree.getWarnings().get(0).getType());
        assertEquals("1500", tree.getWarnings().get(0).getSubject());
    }

    @Test
    @DisplayName("A parent cycle is cut at the lowest code and reported, never looping")
    void testCycle() {
        printTestHeader("Cyclic parents");

        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        UUID c = UUID.randomUUID();
        UUID hanger = UUID.randomUUID();
        List<Account> accounts = List.of(
            account(a, "3100", c),
            account(b, "3200", a),
            account(c, "3300", b),
            account(hanger, "3400", b));

        AccountTree tree = builder.buildTree(accounts, Map.of());

        assertEquals(1, tree.getRoots().size());
        assertEquals("3100", tree.getRoots().get(0).getAccount().getCode());
        assertEquals(4, tree.size());
        assertEquals(1, tree.getWarnings().size());
        assertEquals(DataIntegrityWarning.Type.CYCLIC_PARENT, tree.getWarnings().get(0).getType());
        printSuccess("Cycle cut at 3100; every account appears once");
    }

    @Test
    @DisplayName("An account that is its own parent becomes a root")
    void testSelfParent() {
        UUID self = UUID.randomUUID();
        AccountTree tree = builder.buildTree(List.of(account(self, "1900", self)), Map.of());

        assertEquals(1, tree.getRoots().size());
        assertEquals(DataIntegrityWarning.Type.CYCLIC_PARENT, tree.getWarnings().get(0).getType());
    }

    @Test
    @DisplayName("Nodes hold their own balance; roll-ups add the subtree")
    void testOwnBalanceAndRollUp() {
        UUID parent = UUID.randomUUID();
        UUID child = UUID.randomUUID();
        List<Account> accounts = List.of(account(parent, "1000", null), account(child, "1100", parent));
        Map<String, AccountBalance> balances = Map.of(
            "1000", balance("1000", "100", "0"),
            "1100", balance("1100", "500", "200"));

        AccountTree tree = builder.buildTree(accounts, balances);

        AccountNode root = tree.getRoots().get(0);
        assertEquals(0, new BigDecimal("100").compareTo(root.getReportingNet()));
        assertEquals(0, new BigDecimal("400").compareTo(root.rolledUpReportingNet()));
        assertTrue(tree.find("1100").isPresent());
        assertTrue(tree.find("9999").isEmpty());
    }
}
