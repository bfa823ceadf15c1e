package com.flagship.fx_ledger.revaluation;

import com.flagship.fx_ledger.config.LedgerProperties;
import com.flagship.fx_ledger.fx.FxRate;
import com.flagship.fx_ledger.fx.RateTable;
import com.flagship.fx_ledger.ledger.ForeignBankAccount;
import com.flagship.fx_ledger.ledger.OpenInvoice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Revaluation of open invoices and bank balances.
 */
class UnrealizedFxCalculatorTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 3, 31);

    private final UnrealizedFxCalculator calculator = new UnrealizedFxCalculator(new LedgerProperties());

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private static OpenInvoice invoice(String number, String currency, String total, String bookingRate) {
        return OpenInvoice.builder()
            .id(UUID.randomUUID())
            .invoiceNumber(number)
            .customerName("Acme Ltd")
            .foreignCustomer(true)
            .currency(currency)
            .totalAmount(new BigDecimal(total))
            .historicalRate(bookingRate != null ? new BigDecimal(bookingRate) : null)
            .invoiceDate(LocalDate.of(2024, 1, 10))
            .dueDate(LocalDate.of(2024, 2, 10))
            .build();
    }

    private static FxRate rate(String currency, String value, long sequence) {
        return FxRate.builder()
            .id(UUID.randomUUID())
            .fromCurrency(currency)
            .toCurrency("BDT")
            .date(AS_OF.minusDays(1))
            .rate(new BigDecimal(value))
            .source("manual")
            .active(true)
            .sequenceNumber(sequence)
            .build();
    }

    @Test
    @DisplayName("1,000 USD booked at 110.0 and now 112.5 is a 2,500 gain")
    void testUnpaidInvoiceGain() {
        printTestHeader("Unpaid USD invoice");

        OpenInvoice usd = invoice("INV-001", "USD", "1000", "110.0");
        RateTable rates = RateTable.of(List.of(rate("USD", "112.5", 1)));

        RevaluationResult result = calculator.computePositions(OpenItems.of(List.of(usd), Map.of()), rates, AS_OF);
        printOutput("Result", result);

        assertEquals(1, result.getPositions().size());
        ForeignPosition position = result.getPositions().get(0);
        assertEquals(RateBasis.BOOKING_RATE, position.getRateBasis());
        assertEquals("1400", position.getAccountCode());
        assertEquals(0, new BigDecimal("2500").compareTo(position.getGainLoss()));
        assertEquals(0, new BigDecimal("2500").compareTo(result.getTotalGainLoss()));
        assertTrue(result.getMissingCurrencies().isEmpty());
    }

    @Test
    @DisplayName("300 USD allocated leaves 700 USD and a 1,750 gain")
    void testPartiallyPaidInvoice() {
        OpenInvoice usd = invoice("INV-001", "USD", "1000", "110.0");
        RateTable rates = RateTable.of(List.of(rate("USD", "112.5", 1)));

        RevaluationResult result = calculator.computePositions(
            OpenItems.of(List.of(usd), Map.of(usd.getId(), new BigDecimal("300"))), rates, AS_OF);

        ForeignPosition position = result.getPositions().get(0);
        assertEquals(0, new BigDecimal("700").compareTo(position.getRemainingAmount()));
        assertEquals(0, new BigDecimal("1750").compareTo(result.getTotalGainLoss()));
    }

    @Test
    @DisplayName("Currency without a rate stays visible, is listed as missing and left out of the total")
    void testMissingRate() {
        printTestHeader("Missing EUR rate");

        OpenInvoice usd = invoice("INV-001", "USD", "1000", "110.0");
        OpenInvoice eur1 = invoice("INV-002", "EUR", "500", "120.0");
        OpenInvoice eur2 = invoice("INV-003", "EUR", "250", "121.0");
        RateTable rates = RateTable.of(List.of(rate("USD", "112.5", 1)));

        RevaluationResult result = calculator.computePositions(
            OpenItems.of(List.of(usd, eur1, eur2), Map.of()), rates, AS_OF);
        printOutput("Missing", result.getMissingRates());

        assertEquals(3, result.getPositions().size());
        assertEquals(List.of("EUR"), result.getMissingCurrencies());
        result.getPositions().stream()
            .filter(p -> p.getCurrency().equals("EUR"))
            .forEach(p -> {
                assertNull(p.getCurrentRate());
                assertNull(p.getGainLoss());
            });
        assertEquals(0, new BigDecimal("2500").compareTo(result.getTotalGainLoss()));
        MissingRate missing = result.getMissingRates().get(0);
        assertEquals(2, missing.getPositionsCount());
        assertEquals(0, new BigDecimal("750").compareTo(missing.getTotalAmount()));
    }

    @Test
    @DisplayName("Adding a rate for the missing currency removes it from the missing list")
    void testManualRateClearsMissing() {
        OpenInvoice eur = invoice("INV-002", "EUR", "500", "120.0");
        OpenItems items = OpenItems.of(List.of(eur), Map.of());

        RevaluationResult before = calculator.computePositions(items, RateTable.empty(), AS_OF);
        assertEquals(List.of("EUR"), before.getMissingCurrencies());

        List<FxRate> rows = new ArrayList<>();
        rows.add(rate("EUR", "118.0", 1));
        RevaluationResult after = calculator.computePositions(items, RateTable.of(rows), AS_OF);

        assertTrue(after.getMissingCurrencies().isEmpty());
        assertEquals(0, new BigDecimal("-1000").compareTo(after.getTotalGainLoss()));
    }

    @Test
    @DisplayName("Fully paid and reporting-currency invoices produce no position")
    void testSkippedInvoices() {
        OpenInvoice paid = invoice("INV-004", "USD", "100", "110.0");
        OpenInvoice nearlyPaid = invoice("INV-005", "USD", "100", "110.0");
        OpenInvoice local = invoice("INV-006", "BDT", "5000", null);

        RevaluationResult result = calculator.computePositions(
            OpenItems.of(List.of(paid, nearlyPaid, local),
                Map.of(paid.getId(), new BigDecimal("100"), nearlyPaid.getId(), new BigDecimal("99.995"))),
            RateTable.of(List.of(rate("USD", "112.5", 1))), AS_OF);

        assertTrue(result.getPositions().isEmpty());
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getTotalGainLoss()));
    }

    @Test
    @DisplayName("Invoice without a booking rate has no gain/loss and is not reported as missing")
    void testNoBookingRate() {
        OpenInvoice usd = invoice("INV-007", "USD", "100", null);

        RevaluationResult result = calculator.computePositions(
            OpenItems.of(List.of(usd), Map.of()), RateTable.of(List.of(rate("USD", "112.5", 1))), AS_OF);

        assertNull(result.getPositions().get(0).getGainLoss());
        assertTrue(result.getMissingCurrencies().isEmpty());
    }

    @Test
    @DisplayName("Bank balances are valued at the current rate as reference, with zero gain/loss")
    void testBankPositionsUseReferenceRate() {
        ForeignBankAccount bank = new ForeignBankAccount(UUID.randomUUID(), "USD Operating", "USD", new BigDecimal("2000"));
        ForeignBankAccount empty = new ForeignBankAccount(UUID.randomUUID(), "USD Dormant", "USD", new BigDecimal("0.005"));

        RevaluationResult result = calculator.computePositions(
            new OpenItems(List.of(), Map.of(), List.of(bank, empty)),
            RateTable.of(List.of(rate("USD", "112.5", 1))), AS_OF);

        assertEquals(1, result.getPositions().size());
        ForeignPosition position = result.getPositions().get(0);
        assertEquals(PositionSourceType.BANK_ACCOUNT, position.getSourceType());
        assertEquals(RateBasis.REFERENCE_RATE, position.getRateBasis());
        assertEquals("1200", position.getAccountCode());
        assertEquals(0, BigDecimal.ZERO.compareTo(position.getGainLoss()));
        assertEquals(0, new BigDecimal("225000").compareTo(position.getCurrentReportingValue()));
    }

    @Test
    @DisplayName("Missing currencies are sorted")
    void testMissingCurrenciesSorted() {
        RevaluationResult result = calculator.computePositions(OpenItems.of(List.of(
            invoice("INV-1", "JPY", "100", "0.8"),
            invoice("INV-2", "EUR", "100", "120"),
            invoice("INV-3", "GBP", "100", "140")), Map.of()), RateTable.empty(), AS_OF);

        assertEquals(List.of("EUR", "GBP", "JPY"), result.getMissingCurrencies());
    }
}
