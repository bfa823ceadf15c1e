package com.flagship.fx_ledger.ledger;

import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Domain model for a chart-of-accounts row.
 * Owned by the chart-of-accounts collaborator; the engine only reads it.
 *
 * {@code parentId} is a weak reference to another account's {@code id} and may point
 * at nothing (the hierarchy builder reports that as an orphan).
 */
@Value
public class Account {
    UUID id;
    String code;
    String name;
    AccountType type;
    UUID parentId;
    int level;
    boolean active;

    public Account(UUID id, String code, String name, AccountType type, UUID parentId, int level, boolean active) {
        this.id = Objects.requireNonNull(id, "id");
        this.code = Objects.requireNonNull(code, "code");
        this.name = name != null ? name : code;
        this.type = Objects.requireNonNull(type, "type");
        this.parentId = parentId;
        this.level = level > 0 ? level : 1;
        this.active = active;
    }

    public static Account root(UUID id, String code, String name, AccountType type) {
        return new Account(id, code, name, type, null, 1, true);
    }

    public static Account child(UUID id, String code, String name, AccountType type, UUID parentId) {
        return new Account(id, code, name, type, parentId, 2, true);
    }

    public boolean hasParent() {
        return parentId != null;
    }
}
