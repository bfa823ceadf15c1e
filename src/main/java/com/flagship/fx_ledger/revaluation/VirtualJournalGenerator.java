package com.flagship.fx_ledger.revaluation;

import com.flagship.fx_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Turns revalued positions into a balanced, unposted journal entry.
 *
 * A gain debits the position's account, a loss credits it. The offsets follow: one credit to the
 * unrealized gain account for all gains and one debit to the unrealized loss account for all losses,
 * each left out when zero. Positions whose gain/loss is within the tolerance or unknown produce no line.
 */
@Component
@RequiredArgsConstructor
public class VirtualJournalGenerator {

    private final LedgerProperties properties;

    public VirtualJournalEntry generate(Collection<ForeignPosition> positions, LocalDate asOfDate) {
        BigDecimal tolerance = properties.getTolerance();
        String reportingCurrency = properties.getReportingCurrency();
        LedgerProperties.Revaluation accounts = properties.getRevaluation();

        List<VirtualJournalLine> lines = new ArrayList<>();
        BigDecimal gains = BigDecimal.ZERO;
        BigDecimal losses = BigDecimal.ZERO;

        for (ForeignPosition position : positions) {
            BigDecimal gainLoss = position.getGainLoss();
            if (gainLoss == null || gainLoss.abs().compareTo(tolerance) <= 0) {
                continue;
            }
            if (gainLoss.signum() > 0) {
                gains = gains.add(gainLoss);
                lines.add(VirtualJournalLine.debit(position.getAccountCode(), position.getAccountName(), gainLoss,
                    "Unrealized FX gain on " + position.getSourceReference(), position.getCurrency(), gainLoss));
            } else {
                BigDecimal loss = gainLoss.negate();
                losses = losses.add(loss);
                lines.add(VirtualJournalLine.credit(position.getAccountCode(), position.getAccountName(), loss,
                    "Unrealized FX loss on " + position.getSourceReference(), position.getCurrency(), gainLoss));
            }
        }

        if (gains.signum() > 0) {
            lines.add(VirtualJournalLine.credit(accounts.getGainAccountCode(), accounts.getGainAccountName(), gains,
                "Unrealized foreign exchange gains", reportingCurrency, gains));
        }
        if (losses.signum() > 0) {
            lines.add(VirtualJournalLine.debit(accounts.getLossAccountCode(), accounts.getLossAccountName(), losses,
                "Unrealized foreign exchange losses", reportingCurrency, losses.negate()));
        }
        return new VirtualJournalEntry(asOfDate, lines);
    }
}
