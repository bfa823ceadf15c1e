package com.flagship.fx_ledger.hierarchy;

import com.flagship.fx_ledger.ledger.DataIntegrityWarning;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Forest of account nodes ordered by code, plus the structural warnings found while building it.
 */
public class AccountTree {

    private final List<AccountNode> roots;
    private final List<DataIntegrityWarning> warnings;

    AccountTree(List<AccountNode> roots, List<DataIntegrityWarning> warnings) {
        this.roots = List.copyOf(roots);
        this.warnings = List.copyOf(warnings);
    }

    public List<AccountNode> getRoots() {
        return roots;
    }

    public List<DataIntegrityWarning> getWarnings() {
        return warnings;
    }

    /**
     * Depth-first, pre-order: every parent comes before its children.
     */
    public List<AccountNode> flatten() {
        List<AccountNode> nodes = new ArrayList<>();
        for (AccountNode root : roots) {
            collect(root, nodes);
        }
        return nodes;
    }

    public Optional<AccountNode> find(String accountCode) {
        return flatten().stream()
            .filter(node -> node.getAccount().getCode().equals(accountCode))
            .findFirst();
    }

    public int size() {
        return flatten().size();
    }

    private static void collect(AccountNode node, List<AccountNode> into) {
        into.add(node);
        for (AccountNode child : node.getChildren()) {
            collect(child, into);
        }
    }
}
