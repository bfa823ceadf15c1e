package com.flagship.fx_ledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only view of the ledger store.
 *
 * Rows are created and changed by the data-entry layer; the engine never writes through this interface.
 * Every call made for one report runs inside the same read transaction, so the results form
 * one consistent snapshot. Failures surface as Spring {@code DataAccessException}s.
 */
public interface LedgerRepository {

    /**
     * Lines of posted entries dated on or before {@code asOfDate}, joined with their entry.
     */
    List<JournalLine> listPostedLines(LocalDate asOfDate);

    /**
     * Posted lines of one account, oldest first.
     */
    List<JournalLine> listPostedLinesForAccount(String accountCode, LocalDate asOfDate);

    List<Account> listActiveAccounts(Set<AccountType> types);

    /**
     * Sent invoices of foreign customers, in a currency other than {@code reportingCurrency},
     * dated on or before {@code asOfDate}.
     */
    List<OpenInvoice> listOpenForeignInvoices(LocalDate asOfDate, String reportingCurrency);

    /**
     * All sent invoices dated on or before {@code asOfDate}, any currency.
     */
    List<OpenInvoice> listOpenInvoices(LocalDate asOfDate);

    List<BigDecimal> listAllocations(UUID invoiceId);

    /**
     * Allocated amount per invoice. Invoices without allocations are absent from the map.
     */
    Map<UUID, BigDecimal> sumAllocations(Collection<UUID> invoiceIds);

    List<ForeignBankAccount> listForeignBankAccounts(String reportingCurrency);
}
