package com.flagship.fx_ledger.hierarchy;

import com.flagship.fx_ledger.ledger.Account;
import com.flagship.fx_ledger.ledger.AccountBalance;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An account in the report tree with its own aggregated balance.
 *
 * The node never folds child balances into its own; roll-ups are computed on demand,
 * so report totals can sum own balances without double counting.
 */
public class AccountNode {

    private final Account account;
    private final AccountBalance balance;
    private final int depth;
    private final List<AccountNode> children = new ArrayList<>();

    AccountNode(Account account, AccountBalance balance, int depth) {
        this.account = account;
        this.balance = balance;
        this.depth = depth;
    }

    void addChild(AccountNode child) {
        children.add(child);
    }

    public Account getAccount() {
        return account;
    }

    public AccountBalance getBalance() {
        return balance;
    }

    /**
     * Zero for roots.
     */
    public int getDepth() {
        return depth;
    }

    public List<AccountNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public BigDecimal getReportingNet() {
        return balance.reportingNetFor(account.getType());
    }

    public BigDecimal rolledUpReportingDebit() {
        BigDecimal total = balance.getReportingDebit();
        for (AccountNode child : children) {
            total = total.add(child.rolledUpReportingDebit());
        }
        return total;
    }

    public BigDecimal rolledUpReportingCredit() {
        BigDecimal total = balance.getReportingCredit();
        for (AccountNode child : children) {
            total = total.add(child.rolledUpReportingCredit());
        }
        return total;
    }

    /**
     * Subtree net under this node's type convention.
     */
    public BigDecimal rolledUpReportingNet() {
        return account.getType().net(rolledUpReportingDebit(), rolledUpReportingCredit());
    }

    @Override
    public String toString() {
        return "AccountNode{" + account.getCode() + ", children=" + children.size() + "}";
    }
}
