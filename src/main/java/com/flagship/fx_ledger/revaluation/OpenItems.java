package com.flagship.fx_ledger.revaluation;

import com.flagship.fx_ledger.ledger.ForeignBankAccount;
import com.flagship.fx_ledger.ledger.OpenInvoice;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Open foreign-currency items read for one revaluation run.
 * {@code allocations} maps invoice id to the total allocated so far; missing ids mean nothing allocated.
 */
@Value
public class OpenItems {
    List<OpenInvoice> invoices;
    Map<UUID, BigDecimal> allocations;
    List<ForeignBankAccount> bankAccounts;

    public OpenItems(List<OpenInvoice> invoices, Map<UUID, BigDecimal> allocations,
                     List<ForeignBankAccount> bankAccounts) {
        this.invoices = List.copyOf(invoices);
        this.allocations = Map.copyOf(allocations);
        this.bankAccounts = List.copyOf(bankAccounts);
    }

    public static OpenItems of(List<OpenInvoice> invoices, Map<UUID, BigDecimal> allocations) {
        return new OpenItems(invoices, allocations, List.of());
    }

    public BigDecimal allocatedTo(UUID invoiceId) {
        return allocations.getOrDefault(invoiceId, BigDecimal.ZERO);
    }
}
