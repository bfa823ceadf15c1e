package com.flagship.fx_ledger.fx;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Generated;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for the fx_rates table.
 *
 * Rows are only ever inserted or deactivated, never edited in place.
 */
@Entity
@Table(name = "fx_rates")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class FxRateEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "from_currency", nullable = false, length = 3, updatable = false)
    private String fromCurrency;

    @Column(name = "to_currency", nullable = false, length = 3, updatable = false)
    private String toCurrency;

    @Column(name = "rate_date", nullable = false, updatable = false)
    private LocalDate rateDate;

    @Column(name = "rate", nullable = false, precision = 18, scale = 6, updatable = false)
    private BigDecimal rate;

    @Column(name = "source", nullable = false, length = 50)
    private String source;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Generated
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    public static FxRateEntity fromDomain(FxRate rate) {
        FxRateEntity entity = new FxRateEntity();
        entity.setId(rate.getId());
        entity.setFromCurrency(rate.getFromCurrency());
        entity.setToCurrency(rate.getToCurrency());
        entity.setRateDate(rate.getDate());
        entity.setRate(rate.getRate());
        entity.setSource(rate.getSource());
        entity.setActive(rate.isActive());
        entity.setNotes(rate.getNotes());
        entity.setCreatedAt(rate.getCreatedAt());
        // sequenceNumber is set by database
        return entity;
    }

    public FxRate toDomain() {
        return FxRate.builder()
            .id(id)
            .fromCurrency(fromCurrency)
            .toCurrency(toCurrency)
            .date(rateDate)
            .rate(rate)
            .source(source)
            .active(active)
            .notes(notes)
            .createdAt(createdAt)
            .sequenceNumber(sequenceNumber != null ? sequenceNumber : 0L)
            .build();
    }
}
