package com.flagship.fx_ledger.hierarchy;

import com.flagship.fx_ledger.ledger.Account;
import com.flagship.fx_ledger.ledger.AccountBalance;
import com.flagship.fx_ledger.ledger.BalanceAggregator;
import com.flagship.fx_ledger.ledger.DataIntegrityWarning;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Arranges accounts into a forest following {@code child.parentId -> parent.id}.
 *
 * Accounts are indexed by id and every parent chain is checked before assembly:
 * <ul>
 *   <li>a parent id that matches no listed account makes the child an orphan root (ORPHAN_ACCOUNT)</li>
 *   <li>a chain that loops back is cut at the member with the lowest code, which becomes a root (CYCLIC_PARENT)</li>
 * </ul>
 * Every account appears exactly once. Roots and siblings are ordered by account code.
 */
@Component
@Slf4j
public class AccountHierarchyBuilder {

    private static final Comparator<Account> BY_CODE = Comparator.comparing(Account::getCode);

    public AccountTree buildTree(Collection<Account> accounts, Map<String, AccountBalance> balances) {
        Map<UUID, Account> byId = new LinkedHashMap<>();
        accounts.stream().sorted(BY_CODE).forEach(account -> byId.putIfAbsent(account.getId(), account));

        List<DataIntegrityWarning> warnings = new ArrayList<>();
        Map<UUID, UUID> parentOf = resolveParents(byId, warnings);
        breakCycles(byId, parentOf, warnings);

        Map<UUID, List<Account>> childrenOf = new HashMap<>();
        List<Account> roots = new ArrayList<>();
        for (Account account : byId.values()) {
            UUID parentId = parentOf.get(account.getId());
            if (parentId == null) {
                roots.add(account);
            } else {
                childrenOf.computeIfAbsent(parentId, id -> new ArrayList<>()).add(account);
            }
        }
        childrenOf.values().forEach(children -> children.sort(BY_CODE));
        roots.sort(BY_CODE);

        List<AccountNode> rootNodes = new ArrayList<>(roots.size());
        for (Account root : roots) {
            rootNodes.add(assemble(root, 0, childrenOf, balances));
        }
        return new AccountTree(rootNodes, warnings);
    }

    private Map<UUID, UUID> resolveParents(Map<UUID, Account> byId, List<DataIntegrityWarning> warnings) {
        Map<UUID, UUID> parentOf = new HashMap<>();
        for (Account account : byId.values()) {
            if (!account.hasParent()) {
                continue;
            }
            if (byId.containsKey(account.getParentId())) {
                parentOf.put(account.getId(), account.getParentId());
            } else {
                log.warn("Account parent not found, treating as root: code={}, parentId={}",
                    account.getCode(), account.getParentId());
                warnings.add(DataIntegrityWarning.of(
                    DataIntegrityWarning.Type.ORPHAN_ACCOUNT,
                    account.getCode(),
                    "Parent account " + account.getParentId() + " does not exist or is inactive"));
            }
        }
        return parentOf;
    }

    /**
     * Walks each chain once. A walk that meets its own path has found a cycle.
     */
    private void breakCycles(Map<UUID, Account> byId, Map<UUID, UUID> parentOf, List<DataIntegrityWarning> warnings) {
        Set<UUID> settled = new HashSet<>();
        for (UUID start : byId.keySet()) {
            List<UUID> path = new ArrayList<>();
            Set<UUID> onPath = new HashSet<>();
            UUID current = start;
            while (current != null && !settled.contains(current)) {
                if (!onPath.add(current)) {
                    cut(path.subList(path.indexOf(current), path.size()), byId, parentOf, warnings);
                    break;
                }
                path.add(current);
                current = parentOf.get(current);
            }
            settled.addAll(path);
        }
    }

    private void cut(List<UUID> cycle, Map<UUID, Account> byId, Map<UUID, UUID> parentOf,
                     List<DataIntegrityWarning> warnings) {
        Account newRoot = cycle.stream().map(byId::get).min(BY_CODE).orElseThrow();
        parentOf.remove(newRoot.getId());
        List<String> codes = cycle.stream().map(id -> byId.get(id).getCode()).sorted().toList();
        log.warn("Cyclic parent chain detected, cutting at {}: members={}", newRoot.getCode(), codes);
        warnings.add(DataIntegrityWarning.of(
            DataIntegrityWarning.Type.CYCLIC_PARENT,
            newRoot.getCode(),
            "Parent chain loops through " + String.join(", ", codes)));
    }

    private AccountNode assemble(Account account, int depth, Map<UUID, List<Account>> childrenOf,
                                 Map<String, AccountBalance> balances) {
        AccountNode node = new AccountNode(account, BalanceAggregator.balanceOf(balances, account.getCode()), depth);
        for (Account child : childrenOf.getOrDefault(account.getId(), List.of())) {
            node.addChild(assemble(child, depth + 1, childrenOf, balances));
        }
        return node;
    }
}
