package com.flagship.fx_ledger.report;

import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.fx.FxRateResolver;
import com.flagship.fx_ledger.fx.RateTable;
import com.flagship.fx_ledger.ledger.Account;
import com.flagship.fx_ledger.ledger.AccountLedgerBuilder;
import com.flagship.fx_ledger.ledger.AccountType;
import com.flagship.fx_ledger.ledger.DataIntegrityWarning;
import com.flagship.fx_ledger.ledger.LedgerRepository;
import com.flagship.fx_ledger.ledger.OpenInvoice;
import com.flagship.fx_ledger.observability.CorrelationContext;
import com.flagship.fx_ledger.observability.ReportMetrics;
import com.flagship.fx_ledger.revaluation.RevaluationResult;
import com.flagship.fx_ledger.revaluation.UnrealizedFxCalculator;
import com.flagship.fx_ledger.revaluation.VirtualJournalEntry;
import com.flagship.fx_ledger.revaluation.VirtualJournalGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point for report generation.
 *
 * Each call reads one {@link LedgerSnapshot} inside a single read-only REPEATABLE_READ transaction
 * begun within the report scope, so lines, accounts, invoices, allocations and rates are all seen as of the same moment.
 * The report is then built from that snapshot alone. Nothing is kept between calls:
 * two calls over unchanged data return equal reports.
 *
 * Store failures, including a failure to begin the transaction, abort the report with a
 * {@link ReportGenerationException}. Missing rates and
 * integrity problems do not; they are logged, counted and attached to the report.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    static final String TRIAL_BALANCE = "trial_balance";
    static final String BALANCE_SHEET = "balance_sheet";
    static final String AR_BREAKDOWN = "ar_breakdown";
    static final String UNREALIZED_FX = "unrealized_fx";
    static final String REVALUATION_ENTRY = "revaluation_entry";
    static final String ACCOUNT_LEDGER = "account_ledger";

    private static final Set<AccountType> ALL_TYPES = EnumSet.allOf(AccountType.class);
    private static final Set<AccountType> BALANCE_SHEET_TYPES =
        EnumSet.of(AccountType.ASSET, AccountType.LIABILITY, AccountType.EQUITY);

    private final LedgerRepository ledgerRepository;
    private final FxRateResolver fxRateResolver;
    private final TrialBalanceBuilder trialBalanceBuilder;
    private final BalanceSheetBuilder balanceSheetBuilder;
    private final ArBreakdownBuilder arBreakdownBuilder;
    private final UnrealizedFxCalculator unrealizedFxCalculator;
    private final VirtualJournalGenerator virtualJournalGenerator;
    private final AccountLedgerBuilder accountLedgerBuilder;
    private final LedgerProperties properties;
    private final ReportMetrics reportMetrics;
    private final PlatformTransactionManager transactionManager;

    public TrialBalance buildTrialBalance(LocalDate asOfDate) {
        return run(TRIAL_BALANCE, asOfDate, () -> {
            LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .asOfDate(asOfDate)
                .lines(ledgerRepository.listPostedLines(asOfDate))
                .accounts(ledgerRepository.listActiveAccounts(ALL_TYPES))
                .build();
            TrialBalance report = trialBalanceBuilder.build(snapshot);
            recordWarnings(report.getWarnings());
            log.info("Trial balance built: accounts={}, debits={}, credits={}, balanced={}",
                report.getLines().size(), report.getTotalDebits(), report.getTotalCredits(), report.isBalanced());
            return report;
        });
    }

    public BalanceSheet buildBalanceSheet(LocalDate asOfDate) {
        return run(BALANCE_SHEET, asOfDate, () -> {
            List<OpenInvoice> invoices = ledgerRepository.listOpenForeignInvoices(asOfDate, properties.getReportingCurrency());
            LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .asOfDate(asOfDate)
                .lines(ledgerRepository.listPostedLines(asOfDate))
                .accounts(ledgerRepository.listActiveAccounts(BALANCE_SHEET_TYPES))
                .invoices(invoices)
                .allocations(ledgerRepository.sumAllocations(invoices.stream().map(OpenInvoice::getId).toList()))
                .bankAccounts(ledgerRepository.listForeignBankAccounts(properties.getReportingCurrency()))
                .rates(loadRates(asOfDate))
                .build();
            BalanceSheet report = balanceSheetBuilder.build(snapshot);
            recordWarnings(report.getWarnings());
            recordMissingRates(report.getRevaluation());
            log.info("Balance sheet built: assets={}, liabilities={}, equity={}, unrealizedFx={}, missingCurrencies={}",
                report.getTotalAssets(), report.getTotalLiabilities(), report.getTotalEquity(),
                report.getTotalUnrealizedGainLoss(), report.getMissingCurrencies());
            return report;
        });
    }

    public ArBreakdown buildArBreakdown(LocalDate asOfDate) {
        return run(AR_BREAKDOWN, asOfDate, () -> {
            List<OpenInvoice> invoices = ledgerRepository.listOpenInvoices(asOfDate);
            LedgerSnapshot snapshot = LedgerSnapshot.builder()
                .asOfDate(asOfDate)
                .invoices(invoices)
                .allocations(ledgerRepository.sumAllocations(invoices.stream().map(OpenInvoice::getId).toList()))
                .rates(loadRates(asOfDate))
                .build();
            ArBreakdown report = arBreakdownBuilder.build(snapshot);
            log.info("AR breakdown built: invoices={}, total={} {}",
                report.getItems().size(), report.getTotalReportingAmount(), report.getReportingCurrency());
            return report;
        });
    }

    /**
     * Revalues open foreign-currency invoices and bank balances on the as-of date.
     */
    public RevaluationResult computeUnrealizedFx(LocalDate asOfDate) {
        return run(UNREALIZED_FX, asOfDate, () -> {
            LedgerSnapshot snapshot = loadOpenItems(asOfDate);
            RevaluationResult result = unrealizedFxCalculator.computePositions(
                snapshot.openForeignItems(properties.getReportingCurrency()), snapshot.getRates(), asOfDate);
            recordMissingRates(result);
            log.info("Unrealized FX computed: positions={}, totalGainLoss={}, missingCurrencies={}",
                result.getPositions().size(), result.getTotalGainLoss(), result.getMissingCurrencies());
            return result;
        });
    }

    /**
     * The revaluation entry for the as-of date. Returned for display; never posted.
     */
    public VirtualJournalEntry buildRevaluationEntry(LocalDate asOfDate) {
        return run(REVALUATION_ENTRY, asOfDate, () -> {
            LedgerSnapshot snapshot = loadOpenItems(asOfDate);
            RevaluationResult result = unrealizedFxCalculator.computePositions(
                snapshot.openForeignItems(properties.getReportingCurrency()), snapshot.getRates(), asOfDate);
            recordMissingRates(result);
            return virtualJournalGenerator.generate(result.getPositions(), asOfDate);
        });
    }

    /**
     * @throws IllegalArgumentException if no active account has this code
     */
    public AccountLedger buildAccountLedger(String accountCode, LocalDate asOfDate) {
        return run(ACCOUNT_LEDGER, asOfDate, () -> {
            Account account = ledgerRepository.listActiveAccounts(ALL_TYPES).stream()
                .filter(candidate -> candidate.getCode().equals(accountCode))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountCode));
            AccountLedger ledger = new AccountLedger(account, asOfDate, accountLedgerBuilder.build(
                account, ledgerRepository.listPostedLinesForAccount(accountCode, asOfDate), asOfDate));
            log.info("Account ledger built: account={}, lines={}, closingBalance={}",
                accountCode, ledger.getLines().size(), ledger.getClosingBalance());
            return ledger;
        });
    }

    private LedgerSnapshot loadOpenItems(LocalDate asOfDate) {
        List<OpenInvoice> invoices = ledgerRepository.listOpenForeignInvoices(asOfDate, properties.getReportingCurrency());
        return LedgerSnapshot.builder()
            .asOfDate(asOfDate)
            .invoices(invoices)
            .allocations(ledgerRepository.sumAllocations(invoices.stream().map(OpenInvoice::getId).toList()))
            .bankAccounts(ledgerRepository.listForeignBankAccounts(properties.getReportingCurrency()))
            .rates(loadRates(asOfDate))
            .build();
    }

    private RateTable loadRates(LocalDate asOfDate) {
        return fxRateResolver.snapshot(properties.getReportingCurrency(), asOfDate);
    }

    private <T> T run(String reportType, LocalDate asOfDate, Supplier<T> body) {
        if (asOfDate == null) {
            throw new IllegalArgumentException("As-of date is required");
        }
        long startTime = System.currentTimeMillis();
        try (CorrelationContext.Scope ignored = CorrelationContext.open(reportType, asOfDate)) {
            log.debug("Building report");
            try {
                T report = readOnlyTransaction().execute(status -> body.get());
                reportMetrics.recordReport(reportType, "success", Duration.ofMillis(System.currentTimeMillis() - startTime));
                return report;
            } catch (DataAccessException | TransactionException e) {
                log.error("Ledger store failed while building report: {}", e.getMessage(), e);
                reportMetrics.recordReport(reportType, "failure", Duration.ofMillis(System.currentTimeMillis() - startTime));
                throw new ReportGenerationException(reportType, asOfDate, e);
            }
        }
    }

    /**
     * Opened per call inside {@link #run} so that a failure to begin the transaction is translated too.
     */
    private TransactionTemplate readOnlyTransaction() {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setReadOnly(true);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        return template;
    }

    private void recordWarnings(List<DataIntegrityWarning> warnings) {
        warnings.forEach(warning -> reportMetrics.recordIntegrityWarning(warning.getType().name()));
    }

    private void recordMissingRates(RevaluationResult result) {
        result.getMissingCurrencies().forEach(reportMetrics::recordMissingRate);
    }
}
