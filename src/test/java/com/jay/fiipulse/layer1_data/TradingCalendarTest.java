package com.jay.fiipulse.layer1_data;

import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.model.TradingWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TradingCalendarTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    private static final LocalTime CUTOFF = LocalTime.of(18, 30);

    private PulseConfig config;
    private TradingCalendar calendar;

    @BeforeEach
    void setUp() {
        config = new PulseConfig();
        config.load();
        calendar = new TradingCalendar(config.holidays(), config.calendar(), Clock.system(IST));
    }

    private static ZonedDateTime ist(int y, int m, int d, int hh, int mm) {
        return ZonedDateTime.of(y, m, d, hh, mm, 0, 0, IST);
    }

    @Test
    void isTradingDay_shouldExcludeWeekendsAndHolidays() {
        assertTrue(calendar.isTradingDay(LocalDate.of(2026, 2, 17)));
        assertFalse(calendar.isTradingDay(LocalDate.of(2026, 2, 21)));   // Saturday
        assertFalse(calendar.isTradingDay(LocalDate.of(2026, 2, 22)));   // Sunday
        assertFalse(calendar.isTradingDay(LocalDate.of(2026, 1, 26)));   // Republic Day
    }

    @Test
    void currentWindow_shouldEndTodayAfterCutoff() {
        TradingWindow w = calendar.currentWindow(ist(2026, 2, 17, 19, 0), CUTOFF).orElseThrow();

        assertEquals("10-02-2026", w.fromParam());
        assertEquals("17-02-2026", w.toParam());
        assertEquals(6, w.tradingDays());
        assertTrue(w.complete());
        assertEquals("10-02-2026 → 17-02-2026", w.label());
    }

    @Test
    void currentWindow_shouldTreatCutoffInstantAsPast() {
        TradingWindow w = calendar.currentWindow(ist(2026, 2, 17, 18, 30), CUTOFF).orElseThrow();

        assertEquals(LocalDate.of(2026, 2, 17), w.to());
    }

    @Test
    void currentWindow_shouldUsePreviousTradingDayBeforeCutoff() {
        TradingWindow w = calendar.currentWindow(ist(2026, 2, 17, 10, 0), CUTOFF).orElseThrow();

        assertEquals(LocalDate.of(2026, 2, 16), w.to());
        assertEquals(LocalDate.of(2026, 2, 9), w.from());
    }

    @Test
    void currentWindow_shouldSkipWeekend() {
        TradingWindow w = calendar.currentWindow(ist(2026, 2, 21, 20, 0), CUTOFF).orElseThrow();

        assertEquals(LocalDate.of(2026, 2, 20), w.to());
        assertEquals(LocalDate.of(2026, 2, 13), w.from());
    }

    @Test
    void currentWindow_shouldSkipHolidaysOnBothEnds() {
        // 19 and 20 March 2026 are exchange holidays
        TradingWindow w = calendar.currentWindow(ist(2026, 3, 20, 19, 0), CUTOFF).orElseThrow();

        assertEquals(LocalDate.of(2026, 3, 18), w.to());
        assertEquals(LocalDate.of(2026, 3, 11), w.from());
    }

    @Test
    void currentWindow_shouldConvertNowIntoExchangeZone() {
        // 13:30 UTC is 19:00 IST
        ZonedDateTime utc = ZonedDateTime.of(2026, 2, 17, 13, 30, 0, 0, ZoneId.of("UTC"));

        assertEquals(LocalDate.of(2026, 2, 17), calendar.currentWindow(utc, CUTOFF).orElseThrow().to());
    }

    @Test
    void currentWindow_shouldBeEmptyWhenNoTradingDayWithinLookback() {
        Set<LocalDate> closed = new HashSet<>();
        for (LocalDate d = LocalDate.of(2026, 2, 1); d.isBefore(LocalDate.of(2026, 3, 1)); d = d.plusDays(1)) {
            closed.add(d);
        }
        TradingCalendar shut = new TradingCalendar(closed, config.calendar(), Clock.system(IST));

        Optional<TradingWindow> w = shut.currentWindow(ist(2026, 2, 20, 19, 0), CUTOFF);

        assertTrue(w.isEmpty());
    }

    @Test
    void windowEndingAt_shouldFlagIncompleteWhenCalendarBoundHit() {
        PulseConfig.Calendar tight = new PulseConfig.Calendar();
        tight.setFromDateMaxCalendarDays(3);
        TradingCalendar bounded = new TradingCalendar(Set.of(), tight, Clock.system(IST));

        TradingWindow w = bounded.windowEndingAt(LocalDate.of(2026, 2, 17));

        assertFalse(w.complete());
        assertEquals(LocalDate.of(2026, 2, 16), w.from());
        assertEquals(2, w.tradingDays());
    }

    @Test
    void currentWindow_shouldUseInjectedClock() {
        Clock fixed = Clock.fixed(ist(2026, 2, 17, 19, 0).toInstant(), IST);
        TradingCalendar clocked = new TradingCalendar(config.holidays(), config.calendar(), fixed);

        assertEquals(LocalDate.of(2026, 2, 10), clocked.currentWindow().orElseThrow().from());
    }
}
