package com.flagship.fx_ledger.revaluation;

import com.flagship.fx_ledger.config.LedgerProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class VirtualJournalGeneratorTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 3, 31);

    private final VirtualJournalGenerator generator = new VirtualJournalGenerator(new LedgerProperties());

    private static ForeignPosition position(String reference, String remaining, String historical, String current) {
        return ForeignPosition.builder()
            .sourceId(UUID.randomUUID())
            .sourceType(PositionSourceType.INVOICE)
            .sourceReference(reference)
            .currency("USD")
            .remainingAmount(new BigDecimal(remaining))
            .historicalRate(historical != null ? new BigDecimal(historical) : null)
            .currentRate(current != null ? new BigDecimal(current) : null)
            .rateBasis(RateBasis.BOOKING_RATE)
            .asOfDate(AS_OF)
            .accountCode("1400")
            .accountName("AR - Foreign Customers")
            .build();
    }

    @Test
    @DisplayName("A gain debits the position account and credits Unrealized FX Gain")
    void testGain() {
        VirtualJournalEntry entry = generator.generate(List.of(position("INV-001", "1000", "110.0", "112.5")), AS_OF);

        assertEquals(2, entry.getLines().size());
        VirtualJournalLine receivable = entry.getLines().get(0);
        assertEquals("1400", receivable.getAccountCode());
        assertEquals(0, new BigDecimal("2500").compareTo(receivable.getDebit()));
        assertEquals(0, BigDecimal.ZERO.compareTo(receivable.getCredit()));
        assertEquals("Unrealized FX gain on INV-001", receivable.getDescription());

        VirtualJournalLine offset = entry.getLines().get(1);
        assertEquals("4300", offset.getAccountCode());
        assertEquals("Unrealized FX Gain", offset.getAccountName());
        assertEquals(0, new BigDecimal("2500").compareTo(offset.getCredit()));
        assertTrue(entry.isBalanced());
    }

    @Test
    @DisplayName("A loss credits the position account and debits Unrealized FX Loss")
    void testLoss() {
        VirtualJournalEntry entry = generator.generate(List.of(position("INV-002", "500", "120.0", "118.0")), AS_OF);

        VirtualJournalLine receivable = entry.getLines().get(0);
        assertEquals(0, new BigDecimal("1000").compareTo(receivable.getCredit()));
        assertEquals(0, new BigDecimal("-1000").compareTo(receivable.getFxImpact()));
        VirtualJournalLine offset = entry.getLines().get(1);
        assertEquals("5700", offset.getAccountCode());
        assertEquals(0, new BigDecimal("1000").compareTo(offset.getDebit()));
        assertTrue(entry.isBalanced());
    }

    @Test
    @DisplayName("Mixed gains and losses get one offset line each and balance")
    void testMixed() {
        VirtualJournalEntry entry = generator.generate(List.of(
            position("INV-001", "1000", "110.0", "112.5"),
            position("INV-002", "500", "120.0", "118.0"),
            position("INV-003", "200", "110.0", "111.0")), AS_OF);

        assertEquals(5, entry.getLines().size());
        assertEquals(0, new BigDecimal("3700").compareTo(entry.getTotalDebit()));
        assertEquals(0, entry.getTotalDebit().compareTo(entry.getTotalCredit()));
    }

    @Test
    @DisplayName("Negligible or unknown gain/loss produces no lines")
    void testNoLines() {
        VirtualJournalEntry entry = generator.generate(List.of(
            position("INV-004", "1", "110.000", "110.005"),
            position("INV-005", "100", "110.0", null),
            position("INV-006", "100", null, "112.0")), AS_OF);

        assertTrue(entry.isEmpty());
        assertTrue(entry.isBalanced());
    }
}
