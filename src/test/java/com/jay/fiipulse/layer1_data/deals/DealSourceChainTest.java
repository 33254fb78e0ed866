package com.jay.fiipulse.layer1_data.deals;

import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.model.DealFetchResult;
import com.jay.fiipulse.model.DealRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DealSourceChainTest {

    private static DealRecord deal(String symbol) {
        return DealRecord.builder().symbol(symbol).companyName(symbol).clientName("X").buySell("BUY").build();
    }

    private static DealSource source(String label, List<DealRecord> deals) {
        DealSource s = mock(DealSource.class);
        when(s.label()).thenReturn(label);
        when(s.fetch()).thenReturn(deals);
        return s;
    }

    @Test
    void fetchDeals_shouldStopAtFirstNonEmptyProvider() {
        DealSource primary = source("primary", List.of(deal("INFY")));
        DealSource secondary = source("secondary", List.of(deal("TCS")));

        DealFetchResult result = new DealSourceChain(List.of(primary, secondary)).fetchDeals();

        assertEquals("primary", result.sourceLabel());
        assertEquals("INFY", result.deals().get(0).getSymbol());
        verify(secondary, never()).fetch();
    }

    @Test
    void fetchDeals_shouldSkipEmptyAndFailingProviders() {
        DealSource primary = source("primary", List.of());
        DealSource secondary = mock(DealSource.class);
        when(secondary.label()).thenReturn("secondary");
        when(secondary.fetch()).thenThrow(new IllegalStateException("boom"));
        DealSource tertiary = source("tertiary", List.of(deal("ITC")));

        DealFetchResult result = new DealSourceChain(List.of(primary, secondary, tertiary)).fetchDeals();

        assertEquals("tertiary", result.sourceLabel());
        assertEquals(1, result.deals().size());
    }

    @Test
    void fetchDeals_shouldNeverBeEmptyWithReferenceFallbackLast() {
        PulseConfig config = new PulseConfig();
        config.load();
        DealSource primary = source(NseDealSource.LABEL, List.of());
        DealSource secondary = source(MunafaSutraDealSource.LABEL, List.of());

        DealFetchResult result = new DealSourceChain(
            List.of(primary, secondary, new FallbackDealSource(config))).fetchDeals();

        assertEquals(FallbackDealSource.LABEL, result.sourceLabel());
        assertFalse(result.deals().isEmpty());
    }
}
