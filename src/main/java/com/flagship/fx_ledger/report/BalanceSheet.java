package com.flagship.fx_ledger.report;

import com.flagship.fx_ledger.ledger.DataIntegrityWarning;
import com.flagship.fx_ledger.revaluation.RevaluationResult;
import com.flagship.fx_ledger.revaluation.VirtualJournalEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Asset, liability and equity balances in reporting currency, with the unrealized FX overlay.
 * The overlay is informational: the totals are booked balances and do not include it.
 */
@Value
public class BalanceSheet {
    LocalDate asOfDate;
    List<BalanceSheetLine> assets;
    List<BalanceSheetLine> liabilities;
    List<BalanceSheetLine> equity;
    BigDecimal totalAssets;
    BigDecimal totalLiabilities;
    BigDecimal totalEquity;
    RevaluationResult revaluation;
    VirtualJournalEntry revaluationEntry;
    List<DataIntegrityWarning> warnings;

    public List<String> getMissingCurrencies() {
        return revaluation.getMissingCurrencies();
    }

    public BigDecimal getTotalUnrealizedGainLoss() {
        return revaluation.getTotalGainLoss();
    }

    public BigDecimal getTotalLiabilitiesAndEquity() {
        return totalLiabilities.add(totalEquity);
    }
}
