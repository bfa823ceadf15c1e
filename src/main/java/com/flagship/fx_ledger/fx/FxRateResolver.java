package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.observability.ReportMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves exchange rates and maintains manual rate entries.
 *
 * Resolution picks the active row of the pair with the latest date on or before the as-of date.
 * Rows sharing that date are ordered by sequence number, so the most recent insert wins.
 * A missing rate is an empty result, never an exception; callers decide how to degrade.
 *
 * Manual rates are append-only. With {@link ManualRateMode#SUPERSEDE} the earlier active rows
 * of the same pair and date are deactivated in the same transaction as the insert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FxRateResolver {

    private final FxRateRepository fxRateRepository;
    private final LedgerProperties properties;
    private final ReportMetrics reportMetrics;

    /**
     * @return the governing rate row, or empty if none is active on or before the date
     */
    @Transactional(readOnly = true)
    public Optional<FxRate> resolve(String fromCurrency, String toCurrency, LocalDate asOfDate) {
        if (asOfDate == null) {
            throw new IllegalArgumentException("As-of date is required");
        }
        String from = FxRate.normalizeCurrency(fromCurrency);
        String to = FxRate.normalizeCurrency(toCurrency);
        if (from.equals(to)) {
            return Optional.of(identity(from, asOfDate));
        }
        return fxRateRepository.findCandidates(from, to, asOfDate).stream()
            .findFirst()
            .map(FxRateEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<BigDecimal> resolveRate(String fromCurrency, String toCurrency, LocalDate asOfDate) {
        return resolve(fromCurrency, toCurrency, asOfDate).map(FxRate::getRate);
    }

    /**
     * Loads every active rate into {@code toCurrency} valid on the as-of date.
     * Runs in the caller's transaction when there is one, so the table shares the report snapshot.
     */
    @Transactional(readOnly = true)
    public RateTable snapshot(String toCurrency, LocalDate asOfDate) {
        List<FxRate> rates = fxRateRepository.findActiveInto(FxRate.normalizeCurrency(toCurrency), asOfDate).stream()
            .map(FxRateEntity::toDomain)
            .toList();
        log.debug("Loaded rate table: toCurrency={}, asOfDate={}, rows={}", toCurrency, asOfDate, rates.size());
        return RateTable.of(rates);
    }

    /**
     * Stores a manual rate: 1 {@code currency} = {@code rate} {@code toCurrency} from {@code date}.
     *
     * @throws IllegalArgumentException if the codes are invalid or equal, the rate is not positive,
     *                                  or the date is missing
     */
    @Transactional
    public FxRate applyManualRate(String currency, String toCurrency, BigDecimal rate, LocalDate date) {
        return applyManualRate(currency, toCurrency, rate, date, null);
    }

    @Transactional
    public FxRate applyManualRate(String currency, String toCurrency, BigDecimal rate, LocalDate date, String notes) {
        FxRate manual = FxRate.manual(currency, toCurrency, rate, date, notes);
        ManualRateMode mode = properties.getFx().getManualRateMode();

        if (mode == ManualRateMode.SUPERSEDE) {
            int deactivated = fxRateRepository.deactivateSameDay(
                manual.getFromCurrency(), manual.getToCurrency(), manual.getDate());
            if (deactivated > 0) {
                log.info("Superseded same-day rates: pair={}/{}, date={}, rows={}",
                    manual.getFromCurrency(), manual.getToCurrency(), manual.getDate(), deactivated);
                reportMetrics.recordRatesDeactivated(deactivated);
            }
        }

        FxRateEntity saved = fxRateRepository.saveAndFlush(FxRateEntity.fromDomain(manual));
        reportMetrics.recordManualRate(mode.name());
        log.info("Manual rate stored: id={}, pair={}/{}, date={}, rate={}, mode={}",
            saved.getId(), manual.getFromCurrency(), manual.getToCurrency(), manual.getDate(), manual.getRate(), mode);
        return saved.toDomain();
    }

    /**
     * Soft-deactivates one rate row. Deactivated rows are ignored by resolution.
     *
     * @throws IllegalArgumentException if no row has this id
     */
    @Transactional
    public FxRate deactivateRate(UUID rateId) {
        FxRateEntity entity = fxRateRepository.findById(rateId)
            .orElseThrow(() -> new IllegalArgumentException("Exchange rate not found: " + rateId));
        if (entity.isActive()) {
            entity.setActive(false);
            entity = fxRateRepository.save(entity);
            reportMetrics.recordRatesDeactivated(1);
            log.info("Rate deactivated: id={}, pair={}/{}, date={}",
                rateId, entity.getFromCurrency(), entity.getToCurrency(), entity.getRateDate());
        }
        return entity.toDomain();
    }

    /**
     * Active rows of a pair, newest first.
     */
    @Transactional(readOnly = true)
    public List<FxRate> listRates(String currency, String toCurrency) {
        return fxRateRepository
            .findByFromCurrencyAndToCurrencyAndActiveTrueOrderByRateDateDescSequenceNumberDesc(
                FxRate.normalizeCurrency(currency), FxRate.normalizeCurrency(toCurrency))
            .stream()
            .map(FxRateEntity::toDomain)
            .toList();
    }

    private static FxRate identity(String currency, LocalDate asOfDate) {
        return FxRate.builder()
            .fromCurrency(currency)
            .toCurrency(currency)
            .date(asOfDate)
            .rate(BigDecimal.ONE)
            .source("identity")
            .active(true)
            .build();
    }
}
