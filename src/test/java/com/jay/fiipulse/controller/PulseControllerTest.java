package com.jay.fiipulse.controller;

import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.layer1_data.TradingCalendar;
import com.jay.fiipulse.layer3_signal.PulsePipelineService;
import com.jay.fiipulse.model.DealFetchResult;
import com.jay.fiipulse.model.DealRecord;
import com.jay.fiipulse.model.MarketSummary;
import com.jay.fiipulse.model.PulseReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PulseControllerTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private PulsePipelineService pipeline;
    private MockMvc mvc;

    private static PulseReport report(String source) {
        return PulseReport.builder()
            .generatedAt(LocalDateTime.of(2026, 2, 17, 19, 5))
            .source(source)
            .windowLabel("10-02-2026 → 17-02-2026")
            .market(MarketSummary.builder().build())
            .stocks(List.of())
            .build();
    }

    private MockMvc mvcAt(ZonedDateTime now) {
        PulseConfig config = new PulseConfig();
        config.load();
        TradingCalendar calendar = new TradingCalendar(config.holidays(), config.calendar(),
            Clock.fixed(now.toInstant(), IST));
        return MockMvcBuilders.standaloneSetup(new PulseController(pipeline, calendar)).build();
    }

    @BeforeEach
    void setUp() {
        pipeline = mock(PulsePipelineService.class);
        mvc = mvcAt(ZonedDateTime.of(2026, 2, 17, 19, 0, 0, 0, IST));
    }

    @Test
    void report_shouldServeLatestWithoutRerunning() throws Exception {
        when(pipeline.latest()).thenReturn(Optional.of(report("MunafaSutra")));

        mvc.perform(get("/api/pulse/report"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("MunafaSutra"));

        verify(pipeline, never()).run();
    }

    @Test
    void report_shouldRunWhenRefreshRequested() throws Exception {
        when(pipeline.latest()).thenReturn(Optional.of(report("old")));
        when(pipeline.run()).thenReturn(report("NSE Bulk Deals API"));

        mvc.perform(get("/api/pulse/report").param("refresh", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("NSE Bulk Deals API"));
    }

    @Test
    void report_shouldRunWhenNothingCachedYet() throws Exception {
        when(pipeline.latest()).thenReturn(Optional.empty());
        when(pipeline.run()).thenReturn(report("NSE Bulk Deals API"));

        mvc.perform(get("/api/pulse/report"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.windowLabel").value("10-02-2026 → 17-02-2026"));
    }

    @Test
    void window_shouldDescribeCurrentDisclosureWindow() throws Exception {
        mvc.perform(get("/api/pulse/window"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.tradingDays").value(6))
            .andExpect(jsonPath("$.complete").value(true))
            .andExpect(jsonPath("$.label").value("10-02-2026 → 17-02-2026"));
    }

    @Test
    void deals_shouldReturnNotFoundBeforeFirstRun() throws Exception {
        when(pipeline.latestDeals()).thenReturn(Optional.empty());

        mvc.perform(get("/api/pulse/deals")).andExpect(status().isNotFound());
    }

    @Test
    void deals_shouldExposeRawDealsAndSource() throws Exception {
        DealRecord deal = DealRecord.builder().symbol("POWERGRID").clientName("HDFC MUTUAL FUND").buySell("BUY").build();
        when(pipeline.latestDeals()).thenReturn(Optional.of(new DealFetchResult(List.of(deal), "NSE Bulk Deals API")));

        mvc.perform(get("/api/pulse/deals"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sourceLabel").value("NSE Bulk Deals API"))
            .andExpect(jsonPath("$.deals[0].symbol").value("POWERGRID"));
    }
}
