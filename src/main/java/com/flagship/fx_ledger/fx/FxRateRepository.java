package com.flagship.fx_ledger.fx;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Repository for exchange rate rows.
 */
@Repository
public interface FxRateRepository extends JpaRepository<FxRateEntity, UUID> {

    /**
     * Active rows of one pair dated on or before the cutoff, best candidate first.
     */
    @Query("""
        SELECT r FROM FxRateEntity r
        WHERE r.fromCurrency = :from AND r.toCurrency = :to
        AND r.active = true AND r.rateDate <= :asOf
        ORDER BY r.rateDate DESC, r.sequenceNumber DESC
        """)
    List<FxRateEntity> findCandidates(@Param("from") String fromCurrency,
                                      @Param("to") String toCurrency,
                                      @Param("asOf") LocalDate asOfDate);

    /**
     * All active rows into one target currency dated on or before the cutoff.
     * Loaded once per report to build the in-memory rate table.
     */
    @Query("""
        SELECT r FROM FxRateEntity r
        WHERE r.toCurrency = :to AND r.active = true AND r.rateDate <= :asOf
        ORDER BY r.fromCurrency, r.rateDate DESC, r.sequenceNumber DESC
        """)
    List<FxRateEntity> findActiveInto(@Param("to") String toCurrency, @Param("asOf") LocalDate asOfDate);

    List<FxRateEntity> findByFromCurrencyAndToCurrencyAndActiveTrueOrderByRateDateDescSequenceNumberDesc(
        String fromCurrency, String toCurrency);

    /**
     * Deactivates the active rows of a pair on one date. Used when manual rates supersede.
     *
     * @return number of rows deactivated
     */
    @Modifying
    @Query("""
        UPDATE FxRateEntity r SET r.active = false
        WHERE r.fromCurrency = :from AND r.toCurrency = :to
        AND r.rateDate = :date AND r.active = true
        """)
    int deactivateSameDay(@Param("from") String fromCurrency,
                          @Param("to") String toCurrency,
                          @Param("date") LocalDate date);

    @Query("SELECT MAX(r.rateDate) FROM FxRateEntity r WHERE r.active = true")
    LocalDate findLatestActiveDate();
}
