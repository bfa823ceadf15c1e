package com.flagship.fx_ledger.observability;

import com.flagship.fx_ledger.fx.FxRateRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Health of the ledger store and freshness of the rate table.
 *
 * DOWN if the store cannot be queried. WARNING if the newest active rate is older
 * than {@link #STALE_RATE_DAYS} days, since revaluation would then run on stale rates.
 */
@Component("ledgerStoreHealth")
public class LedgerStoreHealthIndicator implements HealthIndicator {

    static final long STALE_RATE_DAYS = 7;

    private final JdbcTemplate jdbcTemplate;
    private final FxRateRepository fxRateRepository;

    public LedgerStoreHealthIndicator(JdbcTemplate jdbcTemplate, FxRateRepository fxRateRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.fxRateRepository = fxRateRepository;
    }

    @Override
    public Health health() {
        try {
            Long postedEntries = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM journal_entries WHERE status = 'posted'", Long.class);
            LocalDate latestRate = fxRateRepository.findLatestActiveDate();

            Health.Builder builder;
            if (latestRate == null) {
                builder = Health.status("WARNING").withDetail("latestRateDate", "none");
            } else {
                long age = ChronoUnit.DAYS.between(latestRate, LocalDate.now());
                builder = age > STALE_RATE_DAYS ? Health.status("WARNING") : Health.up();
                builder.withDetail("latestRateDate", latestRate.toString())
                       .withDetail("rateAgeDays", age);
            }
            return builder
                    .withDetail("postedEntries", postedEntries != null ? postedEntries : 0L)
                    .withDetail("staleRateThresholdDays", STALE_RATE_DAYS)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
