package com.jay.fiipulse.layer1_data.deals;

import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.layer1_data.HttpClientFactory;
import com.jay.fiipulse.model.DealRecord;
import com.jay.fiipulse.model.enums.InvestorClass;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Source 2 — public FII/DII activity table scraped from MunafaSutra.
 *
 * Each security links to its detail page ({@code /nse/stock/SYMBOL}); the link text is the display
 * name. The row says "bought" for net buying; anything else is read as selling. The page does not
 * separate the two investor classes, so both are set from the same row.
 */
@Slf4j
@Component
@Order(2)
public class MunafaSutraDealSource implements DealSource {

    public static final String LABEL = "MunafaSutra";

    private static final String STOCK_LINK = "/nse/stock/";

    private final PulseConfig.Scrape cfg;
    private final String userAgent;
    private final HttpClientFactory httpClientFactory;

    public MunafaSutraDealSource(PulseConfig config, HttpClientFactory httpClientFactory) {
        this.cfg = config.scrape();
        this.userAgent = config.nse().getUserAgent();
        this.httpClientFactory = httpClientFactory;
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public List<DealRecord> fetch() {
        log.info("[Source 2] MunafaSutra scraper");
        OkHttpClient http = httpClientFactory.newClient(cfg.getTimeoutSeconds(), cfg.getTimeoutSeconds());
        Request request = new Request.Builder()
            .url(cfg.getUrl())
            .header("User-Agent", userAgent)
            .header("Accept", "text/html,application/xhtml+xml,*/*;q=0.8")
            .header("Accept-Language", "en-US,en;q=0.9")
            .get()
            .build();
        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("  !! MunafaSutra: HTTP {}", response.code());
                return List.of();
            }
            List<DealRecord> deals = parse(response.body().string());
            log.info("  -> MunafaSutra: {} stocks", deals.size());
            return deals;
        } catch (IOException | RuntimeException e) {
            log.warn("  !! MunafaSutra: {}", e.getMessage());
            return List.of();
        }
    }

    List<DealRecord> parse(String html) {
        Document doc = Jsoup.parse(html, cfg.getUrl());
        List<DealRecord> deals = new ArrayList<>();
        for (Element a : doc.getElementsByAttributeValueContaining("href", STOCK_LINK)) {
            if (deals.size() >= cfg.getRowLimit()) break;

            String symbol = symbolFromHref(a.attr("href"));
            String name = a.text().trim();
            if (symbol.isEmpty() || name.isEmpty()) continue;

            Element tr = a.parents().stream()
                .filter(p -> p.normalName().equals("tr"))
                .findFirst()
                .orElse(null);
            if (tr == null) continue;

            String rowText = tr.select("td").stream()
                .map(Element::text)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
            String flag = rowText.contains("bought") ? "BUY" : "SELL";

            deals.add(DealRecord.builder()
                .symbol(symbol.toUpperCase(Locale.ROOT))
                .companyName(name)
                .clientName(LABEL.toUpperCase(Locale.ROOT))
                .buySell(flag)
                .declaredInvestor(InvestorClass.FII)
                .declaredInvestor(InvestorClass.DII)
                .build());
        }
        return deals;
    }

    /** {@code .../nse/stock/POWERGRID/} gives POWERGRID; a bare {@code /nse/stock/} gives "". */
    static String symbolFromHref(String href) {
        int at = href.indexOf(STOCK_LINK);
        if (at < 0) return "";
        String rest = href.substring(at + STOCK_LINK.length());
        int slash = rest.indexOf('/');
        return (slash >= 0 ? rest.substring(0, slash) : rest).trim();
    }
}
