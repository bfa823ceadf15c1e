package com.flagship.fx_ledger.report;

import com.flagship.fx_ledger.hierarchy.AccountTree;
import com.flagship.fx_ledger.ledger.DataIntegrityWarning;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
public class TrialBalance {
    LocalDate asOfDate;
    AccountTree tree;
    List<TrialBalanceLine> lines;
    BigDecimal totalDebits;
    BigDecimal totalCredits;
    boolean balanced;
    List<DataIntegrityWarning> warnings;

    public BigDecimal getDifference() {
        return totalDebits.subtract(totalCredits);
    }
}
