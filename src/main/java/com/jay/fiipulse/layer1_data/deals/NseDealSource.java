package com.jay.fiipulse.layer1_data.deals;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.layer1_data.HttpClientFactory;
import com.jay.fiipulse.layer1_data.InMemoryCookieJar;
import com.jay.fiipulse.layer1_data.Sleeper;
import com.jay.fiipulse.layer1_data.TradingCalendar;
import com.jay.fiipulse.model.DealRecord;
import com.jay.fiipulse.model.TradingWindow;
import com.jay.fiipulse.model.enums.DealCategory;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source 1 — NSE historical bulk/block deals API.
 *
 * The endpoint sits behind bot protection: a session must first load the landing page and the
 * deals page so that the anti-bot cookies are set, and only then query
 *   /api/historicalOR/bulk-block-short-deals?optionType=bulk_deals&from=DD-MM-YYYY&to=DD-MM-YYYY
 * Bulk and block deals are fetched independently and merged. A category whose payload has no
 * client column is dropped; the source is abandoned only when nothing else yielded deals.
 * Each request is retried a bounded number of times on an empty body, an HTML page (bot block),
 * a non-200 status or an I/O error.
 */
@Slf4j
@Component
@Order(1)
public class NseDealSource implements DealSource {

    public static final String LABEL = "NSE Bulk Deals API";

    private final PulseConfig.Nse cfg;
    private final TradingCalendar calendar;
    private final HttpClientFactory httpClientFactory;
    private final Sleeper sleeper;
    private final NsePayloadParser parser;

    public NseDealSource(PulseConfig config, TradingCalendar calendar,
                         HttpClientFactory httpClientFactory, Sleeper sleeper, ObjectMapper objectMapper) {
        this.cfg = config.nse();
        this.calendar = calendar;
        this.httpClientFactory = httpClientFactory;
        this.sleeper = sleeper;
        this.parser = new NsePayloadParser(objectMapper);
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public List<DealRecord> fetch() {
        log.info("[Source 1] NSE bulk/block deals API");
        Optional<TradingWindow> window = calendar.currentWindow();
        if (window.isEmpty()) {
            log.warn("  !! No trading window available — skipping NSE");
            return List.of();
        }
        try {
            return fetch(window.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("  !! NSE fetch interrupted");
            return List.of();
        } catch (DealSchemaException e) {
            log.warn("  !! NSE schema not recognised: {}", e.getMessage());
            return List.of();
        } catch (IOException | RuntimeException e) {
            log.warn("  !! NSE error: {}", e.getMessage());
            return List.of();
        }
    }

    List<DealRecord> fetch(TradingWindow window) throws IOException, InterruptedException, DealSchemaException {
        log.info("  -> Range: {} to {}", window.fromParam(), window.toParam());

        InMemoryCookieJar jar = new InMemoryCookieJar();
        OkHttpClient http = httpClientFactory.newSessionClient(
            cfg.getConnectTimeoutSeconds(), cfg.getReadTimeoutSeconds(), jar);
        warmUp(http, jar);

        List<DealRecord> deals = new ArrayList<>();
        int rawRows = 0;
        DealSchemaException schemaFailure = null;
        for (String optionType : cfg.getDealCategories()) {
            DealCategory category = DealCategory.fromOptionType(optionType);
            String url = dealsUrl(category, window);
            log.info("  -> Fetching {}: {}", optionType, url);

            Optional<String> body = fetchWithRetry(http, url, optionType);
            if (body.isEmpty()) {
                log.warn("  !! [{}] failed — skipping", optionType);
                continue;
            }
            NsePayloadParser.Payload payload = parser.parse(body.get());
            if (payload.isEmpty()) {
                log.info("  -> [{}] No data in range", optionType);
            } else {
                Map<String, String> mapping = DealColumnNormalizer.mapping(payload.columns());
                log.info("  -> [{}] Raw columns: {}", optionType, payload.columns());
                log.info("  -> [{}] Normalised columns: {}", optionType, mapping.values());
                rawRows += payload.rows().size();
                try {
                    List<DealRecord> mapped = DealRowMapper.toDeals(payload.rows(), mapping,
                        Collections.nCopies(payload.rows().size(), category));
                    deals.addAll(mapped);
                    log.info("  -> [{}] {} rows, {} usable deals", optionType, payload.rows().size(), mapped.size());
                } catch (DealSchemaException e) {
                    log.warn("  !! [{}] {}; dropping its rows", optionType, e.getMessage());
                    schemaFailure = e;
                }
            }
            sleeper.sleep(cfg.getCategoryPauseMs());
        }

        // a payload lacked its client column and no other category produced deals
        if (deals.isEmpty() && schemaFailure != null) {
            throw schemaFailure;
        }
        if (rawRows == 0) {
            log.warn("  !! No data from any deal category — falling back");
            return List.of();
        }
        log.info("  -> Rows={} usable deals={}", rawRows, deals.size());
        return deals;
    }

    /** Loads the landing and deals pages so the session carries the anti-bot cookies. */
    private void warmUp(OkHttpClient http, InMemoryCookieJar jar) throws IOException, InterruptedException {
        for (String url : List.of(cfg.getLandingUrl(), cfg.getWarmupUrl())) {
            Request request = baseRequest(url)
                .header("Accept", "text/html,application/xhtml+xml,*/*;q=0.8")
                .build();
            try (Response response = http.newCall(request).execute()) {
                log.info("  -> Warm-up {} HTTP {} cookies={}", url, response.code(), jar.names());
            }
            sleeper.sleep(cfg.getWarmupPauseMs());
        }
    }

    Optional<String> fetchWithRetry(OkHttpClient http, String url, String tag) throws InterruptedException {
        int maxAttempts = Math.max(1, cfg.getMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Request request = baseRequest(url)
                .header("Accept", "application/json, text/plain, */*")
                .header("X-Requested-With", "XMLHttpRequest")
                .header("sec-fetch-dest", "empty")
                .header("sec-fetch-mode", "cors")
                .header("sec-fetch-site", "same-origin")
                .build();
            String problem;
            try (Response response = http.newCall(request).execute()) {
                ResponseBody rb = response.body();
                String body = rb != null ? rb.string() : "";
                String preview = body.length() > 60 ? body.substring(0, 60) : body;
                log.info("  -> [{}] HTTP {} | {} chars | {}", tag, response.code(), body.length(), preview.strip());

                if (body.isEmpty()) {
                    problem = "Empty body";
                } else if (body.stripLeading().startsWith("<")) {
                    problem = "HTML returned (bot block)";
                } else if (response.code() != 200) {
                    problem = "HTTP " + response.code();
                } else {
                    if (cfg.isRequestCsv() && NsePayloadParser.looksLikeJson(body)) {
                        log.info("  -> [{}] JSON returned instead of CSV", tag);
                    }
                    return Optional.of(body);
                }
            } catch (IOException e) {
                problem = "attempt error: " + e.getMessage();
            }
            log.warn("  !! [{}] {} (attempt {}/{})", tag, problem, attempt, maxAttempts);
            if (attempt < maxAttempts) {
                sleeper.sleep(cfg.getBackoffMs() * attempt);
            }
        }
        return Optional.empty();
    }

    String dealsUrl(DealCategory category, TradingWindow window) {
        HttpUrl base = HttpUrl.get(cfg.getApiUrl());
        HttpUrl.Builder b = base.newBuilder()
            .addQueryParameter("optionType", category.optionType())
            .addQueryParameter("from", window.fromParam())
            .addQueryParameter("to", window.toParam());
        if (cfg.isRequestCsv()) b.addQueryParameter("csv", "true");
        return b.build().toString();
    }

    private Request.Builder baseRequest(String url) {
        return new Request.Builder()
            .url(url)
            .header("User-Agent", cfg.getUserAgent())
            .header("Accept-Language", "en-US,en;q=0.9")
            .header("Referer", cfg.getLandingUrl())
            .get();
    }
}
