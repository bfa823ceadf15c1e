package com.flagship.fx_ledger.report;

import com.flagship.fx_ledger.fx.RateTable;
import com.flagship.fx_ledger.ledger.Account;
import com.flagship.fx_ledger.ledger.ForeignBankAccount;
import com.flagship.fx_ledger.ledger.JournalLine;
import com.flagship.fx_ledger.ledger.OpenInvoice;
import com.flagship.fx_ledger.revaluation.OpenItems;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything one report reads, loaded inside a single read transaction.
 * Report builders are pure functions of the as-of date and this snapshot.
 */
@Value
@Builder
public class LedgerSnapshot {
    LocalDate asOfDate;
    @Singular
    List<JournalLine> lines;
    @Singular
    List<Account> accounts;
    /**
     * Sent invoices of any currency.
     */
    @Singular
    List<OpenInvoice> invoices;
    /**
     * Allocated total per invoice id.
     */
    @Singular
    Map<UUID, BigDecimal> allocations;
    @Singular
    List<ForeignBankAccount> bankAccounts;
    @Builder.Default
    RateTable rates = RateTable.empty();

    /**
     * Foreign-customer invoices outside the reporting currency, with bank balances, ready for revaluation.
     */
    public OpenItems openForeignItems(String reportingCurrency) {
        List<OpenInvoice> foreign = invoices.stream()
            .filter(OpenInvoice::isForeignCustomer)
            .filter(invoice -> !reportingCurrency.equals(invoice.getCurrency()))
            .toList();
        return new OpenItems(foreign, allocations, bankAccounts);
    }
}
