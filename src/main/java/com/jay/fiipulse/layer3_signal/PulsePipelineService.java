package com.jay.fiipulse.layer3_signal;

import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.layer1_data.Sleeper;
import com.jay.fiipulse.layer1_data.TradingCalendar;
import com.jay.fiipulse.layer1_data.deals.DealSourceChain;
import com.jay.fiipulse.layer1_data.market.MarketSummaryService;
import com.jay.fiipulse.layer1_data.market.PriceHistoryProvider;
import com.jay.fiipulse.layer2_analysis.IndicatorEngine;
import com.jay.fiipulse.layer2_analysis.InstitutionalClassifier;
import com.jay.fiipulse.model.DealFetchResult;
import com.jay.fiipulse.model.EnrichedStock;
import com.jay.fiipulse.model.InstitutionalStock;
import com.jay.fiipulse.model.MarketSummary;
import com.jay.fiipulse.model.PriceBar;
import com.jay.fiipulse.model.PulseReport;
import com.jay.fiipulse.model.TechnicalSnapshot;
import com.jay.fiipulse.model.TradingWindow;
import com.jay.fiipulse.model.enums.CashAction;
import com.jay.fiipulse.model.enums.OverallSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Layer 3 — run orchestration.
 *
 * One run: deal-source chain → institutional classification → market summary → per-security
 * price history, indicators and score → {@link PulseReport}.
 *
 * Securities are processed on a fixed pool of {@code price.workers} threads, each task pausing
 * for the politeness delay before its price request. Each security's fetch → indicators → score
 * runs inside one task, and a failure there only neutralises that security. Output keeps the
 * classifier's order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PulsePipelineService {

    private final PulseConfig config;
    private final TradingCalendar calendar;
    private final DealSourceChain dealSourceChain;
    private final InstitutionalClassifier institutionalClassifier;
    private final MarketSummaryService marketSummaryService;
    private final PriceHistoryProvider priceHistory;
    private final IndicatorEngine indicatorEngine;
    private final CompositeSignalClassifier signalClassifier;
    private final Sleeper sleeper;
    private final Clock clock;

    private final AtomicReference<PulseReport> latest = new AtomicReference<>();
    private final AtomicReference<DealFetchResult> latestDeals = new AtomicReference<>();

    public PulseReport run() {
        log.info("FII/DII pulse run starting");
        String windowLabel = calendar.currentWindow().map(TradingWindow::label).orElse("N/A");

        DealFetchResult deals = dealSourceChain.fetchDeals();
        latestDeals.set(deals);
        List<InstitutionalStock> stocks = institutionalClassifier.classify(deals.deals());
        log.info("Source '{}': {} securities", deals.sourceLabel(), stocks.size());

        MarketSummary market = marketSummaryService.fetch();
        List<EnrichedStock> enriched = enrichAll(stocks);

        PulseReport report = PulseReport.builder()
            .generatedAt(LocalDateTime.now(clock))
            .source(deals.sourceLabel())
            .windowLabel(windowLabel)
            .market(market)
            .stocks(List.copyOf(enriched))
            .fiiBuyCount((int) enriched.stream().filter(e -> e.getStock().getFiiCash() == CashAction.BUY).count())
            .diiBuyCount((int) enriched.stream().filter(e -> e.getStock().getDiiCash() == CashAction.BUY).count())
            .bothBuyCount((int) enriched.stream().filter(EnrichedStock::isBothBuy).count())
            .strongBuyCount((int) enriched.stream()
                .filter(e -> e.getTechnicals().getOverallSignal() == OverallSignal.STRONG_BUY).count())
            .build();
        latest.set(report);
        log.info("Pulse run complete: {} securities, {} both-buy, {} STRONG BUY",
            enriched.size(), report.getBothBuyCount(), report.getStrongBuyCount());
        return report;
    }

    public Optional<PulseReport> latest() {
        return Optional.ofNullable(latest.get());
    }

    /** Raw deals behind the latest report. */
    public Optional<DealFetchResult> latestDeals() {
        return Optional.ofNullable(latestDeals.get());
    }

    List<EnrichedStock> enrichAll(List<InstitutionalStock> stocks) {
        if (stocks.isEmpty()) return List.of();
        int workers = Math.max(1, Math.min(config.price().getWorkers(), stocks.size()));
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<CompletableFuture<EnrichedStock>> futures = stocks.stream()
                .map(stock -> CompletableFuture.supplyAsync(() -> enrich(stock), executor))
                .toList();

            List<EnrichedStock> out = new ArrayList<>(stocks.size());
            for (int i = 0; i < futures.size(); i++) {
                InstitutionalStock stock = stocks.get(i);
                try {
                    out.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    log.warn("  {}: pipeline failed: {}", stock.getSymbol(), e.getCause().toString());
                    out.add(assemble(stock, TechnicalSnapshot.neutral()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Pulse run interrupted at {}", stock.getSymbol());
                    out.add(assemble(stock, TechnicalSnapshot.neutral()));
                }
            }
            return out;
        } finally {
            executor.shutdownNow();
        }
    }

    EnrichedStock enrich(InstitutionalStock stock) {
        return assemble(stock, technicalsFor(stock.getSymbol()));
    }

    TechnicalSnapshot technicalsFor(String symbol) {
        String ticker = symbol + config.price().getSymbolSuffix();
        log.info("  Indicators {}", ticker);
        try {
            sleeper.sleep(config.price().getRequestDelayMs());
            LocalDate to = LocalDate.now(clock);
            LocalDate from = to.minusDays(config.price().getHistoryDays());
            List<PriceBar> bars = priceHistory.fetchDaily(ticker, from, to);
            return indicatorEngine.compute(ticker, bars);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("  {}: interrupted before price fetch", ticker);
            return TechnicalSnapshot.neutral();
        } catch (IOException | RuntimeException e) {
            log.warn("  {}: price history failed: {}", ticker, e.getMessage());
            return TechnicalSnapshot.neutral();
        }
    }

    private EnrichedStock assemble(InstitutionalStock stock, TechnicalSnapshot technicals) {
        boolean fiiBuy = stock.getFiiCash() == CashAction.BUY;
        boolean diiBuy = stock.getDiiCash() == CashAction.BUY;
        return EnrichedStock.builder()
            .stock(stock)
            .technicals(technicals)
            .flowSignal(signalClassifier.flowSignal(stock))
            .bothBuy(fiiBuy && diiBuy)
            .fiiOnly(fiiBuy && !diiBuy)
            .diiOnly(diiBuy && !fiiBuy)
            .build();
    }
}
