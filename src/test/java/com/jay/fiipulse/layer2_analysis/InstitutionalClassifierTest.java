package com.jay.fiipulse.layer2_analysis;

import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.model.DealRecord;
import com.jay.fiipulse.model.InstitutionalStock;
import com.jay.fiipulse.model.enums.CashAction;
import com.jay.fiipulse.model.enums.InvestorClass;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InstitutionalClassifierTest {

    private static final List<String> FII = List.of("MORGAN STANLEY", "FPI", "global");
    private static final List<String> DII = List.of("MUTUAL FUND", "INSURANCE", " ");

    private final InstitutionalClassifier classifier = new InstitutionalClassifier(FII, DII, false);

    private static DealRecord deal(String symbol, String client, String flag) {
        return deal(symbol, client, flag, null);
    }

    private static DealRecord deal(String symbol, String client, String flag, LocalDate date) {
        return DealRecord.builder()
            .symbol(symbol)
            .companyName(symbol + " Ltd")
            .clientName(client)
            .buySell(flag)
            .tradeDate(date)
            .build();
    }

    @Test
    void classify_shouldMarkDomesticBuyer() {
        List<InstitutionalStock> stocks = classifier.classify(List.of(deal("POWERGRID", "HDFC MUTUAL FUND", "BUY")));

        assertEquals(1, stocks.size());
        InstitutionalStock s = stocks.get(0);
        assertEquals("POWERGRID", s.getSymbol());
        assertEquals("POWERGRID Ltd", s.getName());
        assertEquals(CashAction.BUY, s.getDiiCash());
        assertEquals(CashAction.NEUTRAL, s.getFiiCash());
    }

    @Test
    void investorClasses_shouldMatchCaseInsensitively() {
        assertEquals(EnumSet.of(InvestorClass.FII),
            classifier.investorClasses(deal("X", "Societe Generale Global Markets", "S")));
        assertEquals(EnumSet.of(InvestorClass.FII, InvestorClass.DII),
            classifier.investorClasses(deal("X", "Global Insurance Co", "B")));
        assertTrue(classifier.investorClasses(deal("X", "RAJESH KUMAR", "B")).isEmpty());
        assertTrue(classifier.investorClasses(deal("X", null, "B")).isEmpty());
    }

    @Test
    void investorClasses_shouldPreferDeclaredClass() {
        DealRecord declared = DealRecord.builder()
            .symbol("INFY").clientName("MORGAN STANLEY").buySell("BUY")
            .declaredInvestor(InvestorClass.DII)
            .build();

        assertEquals(EnumSet.of(InvestorClass.DII), classifier.investorClasses(declared));
    }

    @Test
    void classify_shouldSetBothSlotsForDualMatch() {
        InstitutionalStock s = classifier.classify(
            List.of(deal("ITC", "GLOBAL INSURANCE FUND", "SELL"))).get(0);

        assertEquals(CashAction.SELL, s.getFiiCash());
        assertEquals(CashAction.SELL, s.getDiiCash());
    }

    @Test
    void classify_shouldLetLaterDealOverwriteEachSlotIndependently() {
        List<InstitutionalStock> stocks = classifier.classify(List.of(
            deal("INFY", "MORGAN STANLEY ASIA", "BUY"),
            deal("INFY", "SBI MUTUAL FUND", "BUY"),
            deal("INFY", "MORGAN STANLEY ASIA", "SELL")));

        InstitutionalStock s = stocks.get(0);
        assertEquals(CashAction.SELL, s.getFiiCash());
        assertEquals(CashAction.BUY, s.getDiiCash());
    }

    @Test
    void classify_shouldRetainUnmatchedSecuritiesAsNeutral() {
        List<InstitutionalStock> stocks = classifier.classify(List.of(
            deal("ZOMATO", "RAJESH KUMAR", "BUY"),
            deal("TCS", "NIPPON MUTUAL FUND", "B")));

        assertEquals(List.of("ZOMATO", "TCS"), stocks.stream().map(InstitutionalStock::getSymbol).toList());
        assertEquals(CashAction.NEUTRAL, stocks.get(0).getFiiCash());
        assertEquals(CashAction.NEUTRAL, stocks.get(0).getDiiCash());
        assertEquals(CashAction.BUY, stocks.get(1).getDiiCash());
    }

    @Test
    void classify_shouldReturnEmptyForNoDeals() {
        assertTrue(classifier.classify(List.of()).isEmpty());
    }

    @Test
    void classify_shouldFoldInTradeDateOrderWhenConfigured() {
        List<DealRecord> deals = List.of(
            deal("HDFCBANK", "ICICI PRUDENTIAL MUTUAL FUND", "SELL", LocalDate.of(2026, 2, 17)),
            deal("HDFCBANK", "ICICI PRUDENTIAL MUTUAL FUND", "BUY", LocalDate.of(2026, 2, 12)));

        assertEquals(CashAction.BUY, classifier.classify(deals).get(0).getDiiCash());
        assertEquals(CashAction.SELL,
            new InstitutionalClassifier(FII, DII, true).classify(deals).get(0).getDiiCash());
    }

    @Test
    void classify_shouldUseReferenceKeywordTables() {
        PulseConfig config = new PulseConfig();
        config.load();
        InstitutionalClassifier fromConfig = new InstitutionalClassifier(config);

        InstitutionalStock s = fromConfig.classify(List.of(
            deal("GMRAIRPORT", "Morgan Stanley Asia (Singapore) Pte", "SELL"))).get(0);

        assertEquals(CashAction.SELL, s.getFiiCash());
    }
}
