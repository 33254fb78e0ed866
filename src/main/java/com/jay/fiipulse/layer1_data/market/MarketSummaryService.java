package com.jay.fiipulse.layer1_data.market;

import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.model.IndexQuote;
import com.jay.fiipulse.model.MarketSummary;
import com.jay.fiipulse.model.PriceBar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Benchmark snapshot (NIFTY 50, SENSEX): last close and day-over-day change.
 * A failed index is reported as zeros; it never fails the run.
 */
@Slf4j
@Service
public class MarketSummaryService {

    private final PulseConfig.Market cfg;
    private final PriceHistoryProvider prices;
    private final Clock clock;

    @Autowired
    public MarketSummaryService(PulseConfig config, PriceHistoryProvider prices) {
        this(config.market(), prices, Clock.system(ZoneId.of(config.calendar().getZone())));
    }

    MarketSummaryService(PulseConfig.Market cfg, PriceHistoryProvider prices, Clock clock) {
        this.cfg = cfg;
        this.prices = prices;
        this.clock = clock;
    }

    public MarketSummary fetch() {
        log.info("Fetching market summary for {} indices", cfg.getIndices().size());
        LocalDate to = LocalDate.now(clock);
        LocalDate from = to.minusDays(cfg.getHistoryDays());
        MarketSummary.MarketSummaryBuilder summary = MarketSummary.builder()
            .fetchedAt(LocalDateTime.now(clock));
        for (PulseConfig.Benchmark b : cfg.getIndices()) {
            summary.index(quote(b, from, to));
        }
        return summary.build();
    }

    private IndexQuote quote(PulseConfig.Benchmark b, LocalDate from, LocalDate to) {
        try {
            List<PriceBar> bars = prices.fetchDaily(b.getTicker(), from, to);
            if (bars.isEmpty()) {
                log.warn("Market summary {}: no data", b.getName());
                return IndexQuote.unavailable(b.getName(), b.getTicker());
            }
            double last = bars.get(bars.size() - 1).getClose();
            double change = 0;
            if (bars.size() >= 2) {
                double prev = bars.get(bars.size() - 2).getClose();
                change = prev != 0 ? (last - prev) / prev * 100 : 0;
            }
            return new IndexQuote(b.getName(), b.getTicker(), round2(last), round2(change));
        } catch (IOException | RuntimeException e) {
            log.warn("Market summary {} failed: {}", b.getName(), e.getMessage());
            return IndexQuote.unavailable(b.getName(), b.getTicker());
        }
    }

    private static double round2(double v) {
        return new BigDecimal(v).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
