package com.jay.fiipulse.layer1_data;

import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.model.TradingWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.Set;

/**
 * Layer 1 — NSE trading calendar.
 * Resolves the most recent completed bulk/block disclosure window.
 *
 * Block-deal disclosures close at the cutoff (18:30 IST):
 *   After the cutoff on a trading day → to-date is today.
 *   Otherwise                         → to-date is the previous trading day.
 * The from-date sits exactly five trading days before the to-date, giving a
 * six-trading-day inclusive window (e.g. 10-02-2026 → 17-02-2026).
 */
@Slf4j
@Component
public class TradingCalendar {

    private final Set<LocalDate> holidays;
    private final PulseConfig.Calendar cfg;
    private final ZoneId zone;
    private final Clock clock;

    @Autowired
    public TradingCalendar(PulseConfig config) {
        this(config.holidays(), config.calendar(), Clock.system(ZoneId.of(config.calendar().getZone())));
    }

    public TradingCalendar(Set<LocalDate> holidays, PulseConfig.Calendar cfg, Clock clock) {
        this.holidays = Set.copyOf(holidays);
        this.cfg = cfg;
        this.zone = ZoneId.of(cfg.getZone());
        this.clock = clock;
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) return false;
        return !holidays.contains(date);
    }

    /** Window as of the injected clock. */
    public Optional<TradingWindow> currentWindow() {
        return currentWindow(ZonedDateTime.now(clock), cfg.getCutoffTime());
    }

    /**
     * Returns the window ending at the last completed disclosure day, or empty when no trading
     * day exists within the to-date lookback (the caller then skips the exchange source).
     */
    public Optional<TradingWindow> currentWindow(ZonedDateTime now, LocalTime cutoff) {
        ZonedDateTime local = now.withZoneSameInstant(zone);
        LocalDate today = local.toLocalDate();
        boolean pastCutoff = !local.toLocalTime().isBefore(cutoff);

        Optional<LocalDate> toDate = pastCutoff && isTradingDay(today)
            ? Optional.of(today)
            : lastTradingDayBefore(today);
        if (toDate.isEmpty()) {
            log.warn("No trading day found within {} days before {}", cfg.getToDateLookbackDays(), today);
            return Optional.empty();
        }
        log.debug("{} cutoff {} — to-date {}", pastCutoff ? "Past" : "Before", cutoff, toDate.get());
        return Optional.of(windowEndingAt(toDate.get()));
    }

    /** Walks back from {@code to} counting trading days only, bounded in calendar days. */
    public TradingWindow windowEndingAt(LocalDate to) {
        int required = cfg.getFromDateTradingSteps();
        LocalDate from = to;
        int steps = 0;
        LocalDate candidate = to.minusDays(1);
        while (steps < required) {
            if (ChronoUnit.DAYS.between(candidate, to) > cfg.getFromDateMaxCalendarDays()) {
                log.warn("Could not find {} trading days within {} calendar days before {}",
                    required, cfg.getFromDateMaxCalendarDays(), to);
                break;
            }
            if (isTradingDay(candidate)) {
                steps++;
                from = candidate;
            }
            candidate = candidate.minusDays(1);
        }
        TradingWindow window = new TradingWindow(from, to, steps + 1, steps == required);
        log.info("Deal window: {} ({} trading days)", window.label(), window.tradingDays());
        return window;
    }

    private Optional<LocalDate> lastTradingDayBefore(LocalDate today) {
        LocalDate d = today.minusDays(1);
        for (int i = 0; i < cfg.getToDateLookbackDays(); i++) {
            if (isTradingDay(d)) return Optional.of(d);
            d = d.minusDays(1);
        }
        return Optional.empty();
    }
}
