package com.flagship.fx_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JDBC implementation of the ledger store reads.
 *
 * Plain SQL through JdbcTemplate, mapped straight into the immutable domain rows.
 * The surrounding report transaction provides the snapshot; this class opens none of its own.
 */
@Repository
public class JdbcLedgerRepository implements LedgerRepository {

    private static final String LINE_COLUMNS =
        "l.id, l.journal_entry_id, e.entry_date, e.status, e.description AS entry_description, e.reference, " +
        "l.account_code, l.debit_amount, l.credit_amount, l.reporting_debit_amount, l.reporting_credit_amount, " +
        "l.original_currency, l.fx_rate ";

    private static final String INVOICE_COLUMNS =
        "i.id, i.invoice_number, c.name AS customer_name, c.customer_type, i.currency, i.total_amount, " +
        "i.exchange_rate, i.invoice_date, i.due_date ";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public JdbcLedgerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    public List<JournalLine> listPostedLines(LocalDate asOfDate) {
        return jdbcTemplate.query(
            "SELECT " + LINE_COLUMNS +
            "FROM journal_entry_lines l JOIN journal_entries e ON e.id = l.journal_entry_id " +
            "WHERE e.status = 'posted' AND e.entry_date <= ? " +
            "ORDER BY e.entry_date, l.sequence_number",
            journalLineRowMapper(),
            Date.valueOf(asOfDate)
        );
    }

    @Override
    public List<JournalLine> listPostedLinesForAccount(String accountCode, LocalDate asOfDate) {
        return jdbcTemplate.query(
            "SELECT " + LINE_COLUMNS +
            "FROM journal_entry_lines l JOIN journal_entries e ON e.id = l.journal_entry_id " +
            "WHERE e.status = 'posted' AND e.entry_date <= ? AND l.account_code = ? " +
            "ORDER BY e.entry_date, l.sequence_number",
            journalLineRowMapper(),
            Date.valueOf(asOfDate),
            accountCode
        );
    }

    @Override
    public List<Account> listActiveAccounts(Set<AccountType> types) {
        if (types.isEmpty()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource("types",
            types.stream().map(AccountType::toColumn).collect(Collectors.toList()));
        return namedJdbcTemplate.query(
            "SELECT id, account_code, account_name, account_type, parent_account_id, level, is_active " +
            "FROM chart_of_accounts WHERE is_active = TRUE AND account_type IN (:types) " +
            "ORDER BY account_code",
            params,
            accountRowMapper()
        );
    }

    @Override
    public List<OpenInvoice> listOpenForeignInvoices(LocalDate asOfDate, String reportingCurrency) {
        return jdbcTemplate.query(
            "SELECT " + INVOICE_COLUMNS +
            "FROM invoices i JOIN customers c ON c.id = i.customer_id " +
            "WHERE i.status = 'sent' AND c.customer_type = 'foreign' AND i.currency <> ? AND i.invoice_date <= ? " +
            "ORDER BY i.invoice_date, i.invoice_number",
            invoiceRowMapper(),
            reportingCurrency,
            Date.valueOf(asOfDate)
        );
    }

    @Override
    public List<OpenInvoice> listOpenInvoices(LocalDate asOfDate) {
        return jdbcTemplate.query(
            "SELECT " + INVOICE_COLUMNS +
            "FROM invoices i JOIN customers c ON c.id = i.customer_id " +
            "WHERE i.status = 'sent' AND i.invoice_date <= ? " +
            "ORDER BY i.due_date, i.invoice_number",
            invoiceRowMapper(),
            Date.valueOf(asOfDate)
        );
    }

    @Override
    public List<BigDecimal> listAllocations(UUID invoiceId) {
        return jdbcTemplate.queryForList(
            "SELECT allocated_amount FROM payment_allocations WHERE invoice_id = ? ORDER BY created_at",
            BigDecimal.class,
            invoiceId
        );
    }

    @Override
    public Map<UUID, BigDecimal> sumAllocations(Collection<UUID> invoiceIds) {
        Map<UUID, BigDecimal> totals = new HashMap<>();
        if (invoiceIds.isEmpty()) {
            return totals;
        }
        namedJdbcTemplate.query(
            "SELECT invoice_id, SUM(allocated_amount) AS allocated FROM payment_allocations " +
            "WHERE invoice_id IN (:ids) GROUP BY invoice_id",
            new MapSqlParameterSource("ids", invoiceIds),
            rs -> {
                totals.put(UUID.fromString(rs.getString("invoice_id")), rs.getBigDecimal("allocated"));
            }
        );
        return totals;
    }

    @Override
    public List<ForeignBankAccount> listForeignBankAccounts(String reportingCurrency) {
        return jdbcTemplate.query(
            "SELECT id, name, currency, balance FROM bank_accounts " +
            "WHERE is_active = TRUE AND currency <> ? ORDER BY name",
            (rs, rowNum) -> new ForeignBankAccount(
                UUID.fromString(rs.getString("id")),
                rs.getString("name"),
                rs.getString("currency"),
                rs.getBigDecimal("balance")
            ),
            reportingCurrency
        );
    }

    private RowMapper<JournalLine> journalLineRowMapper() {
        return (rs, rowNum) -> JournalLine.builder()
            .id(UUID.fromString(rs.getString("id")))
            .entryId(UUID.fromString(rs.getString("journal_entry_id")))
            .entryDate(rs.getDate("entry_date").toLocalDate())
            .entryStatus(JournalEntryStatus.fromColumn(rs.getString("status")))
            .entryDescription(rs.getString("entry_description"))
            .entryReference(rs.getString("reference"))
            .accountCode(rs.getString("account_code"))
            .debitAmount(rs.getBigDecimal("debit_amount"))
            .creditAmount(rs.getBigDecimal("credit_amount"))
            .reportingDebit(rs.getBigDecimal("reporting_debit_amount"))
            .reportingCredit(rs.getBigDecimal("reporting_credit_amount"))
            .originalCurrency(rs.getString("original_currency"))
            .fxRate(rs.getBigDecimal("fx_rate"))
            .build();
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            String parentId = rs.getString("parent_account_id");
            return new Account(
                UUID.fromString(rs.getString("id")),
                rs.getString("account_code"),
                rs.getString("account_name"),
                AccountType.fromColumn(rs.getString("account_type")),
                parentId != null ? UUID.fromString(parentId) : null,
                rs.getInt("level"),
                rs.getBoolean("is_active")
            );
        };
    }

    private RowMapper<OpenInvoice> invoiceRowMapper() {
        return (rs, rowNum) -> OpenInvoice.builder()
            .id(UUID.fromString(rs.getString("id")))
            .invoiceNumber(rs.getString("invoice_number"))
            .customerName(rs.getString("customer_name"))
            .foreignCustomer("foreign".equals(rs.getString("customer_type")))
            .currency(rs.getString("currency"))
            .totalAmount(rs.getBigDecimal("total_amount"))
            .historicalRate(rs.getBigDecimal("exchange_rate"))
            .invoiceDate(rs.getDate("invoice_date").toLocalDate())
            .dueDate(rs.getDate("due_date").toLocalDate())
            .build();
    }
}
