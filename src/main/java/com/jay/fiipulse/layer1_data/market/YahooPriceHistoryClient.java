package com.jay.fiipulse.layer1_data.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.layer1_data.HttpClientFactory;
import com.jay.fiipulse.model.PriceBar;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Yahoo Finance v8 chart endpoint. The payload holds parallel arrays (timestamp, and open/high/
 * low/close/volume under {@code indicators.quote[0]}); any index where one of them is null is a
 * partial bar and is dropped. Several bars can land on the same exchange date (the live bar
 * during market hours); the latest one wins.
 */
@Slf4j
@Component
public class YahooPriceHistoryClient implements PriceHistoryProvider {

    private final PulseConfig.Price cfg;
    private final ZoneId exchangeZone;
    private final String userAgent;
    private final OkHttpClient http;
    private final ObjectMapper objectMapper;

    public YahooPriceHistoryClient(PulseConfig config, HttpClientFactory httpClientFactory, ObjectMapper objectMapper) {
        this.cfg = config.price();
        this.exchangeZone = ZoneId.of(config.calendar().getZone());
        this.userAgent = config.nse().getUserAgent();
        this.http = httpClientFactory.newClient(cfg.getTimeoutSeconds(), cfg.getTimeoutSeconds());
        this.objectMapper = objectMapper;
    }

    @Override
    public List<PriceBar> fetchDaily(String ticker, LocalDate from, LocalDate to) throws IOException {
        long period1 = from.atStartOfDay(exchangeZone).toEpochSecond();
        long period2 = to.plusDays(1).atStartOfDay(exchangeZone).toEpochSecond();
        HttpUrl url = HttpUrl.get(cfg.getChartUrl()).newBuilder()
            .addPathSegment(ticker)
            .addQueryParameter("period1", String.valueOf(period1))
            .addQueryParameter("period2", String.valueOf(period2))
            .addQueryParameter("interval", "1d")
            .build();

        Request request = new Request.Builder()
            .url(url)
            .header("User-Agent", userAgent)
            .header("Accept", "application/json")
            .get()
            .build();
        try (Response response = http.newCall(request).execute()) {
            if (response.code() == 404) {
                log.warn("Yahoo chart {}: unknown ticker", ticker);
                return List.of();
            }
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("Yahoo chart " + ticker + ": HTTP " + response.code());
            }
            List<PriceBar> bars = parseChart(response.body().string());
            log.debug("Yahoo chart {}: {} bars", ticker, bars.size());
            return bars;
        }
    }

    List<PriceBar> parseChart(String json) throws IOException {
        JsonNode chart = objectMapper.readTree(json).path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new IOException("Yahoo chart error: " + error.path("description").asText(error.toString()));
        }
        JsonNode result = chart.path("result");
        if (!result.isArray() || result.isEmpty()) return List.of();

        JsonNode series = result.get(0);
        ZoneId zone = zoneOf(series.path("meta"));
        JsonNode timestamps = series.path("timestamp");
        JsonNode quote = series.path("indicators").path("quote").path(0);
        JsonNode open = quote.path("open");
        JsonNode high = quote.path("high");
        JsonNode low = quote.path("low");
        JsonNode close = quote.path("close");
        JsonNode volume = quote.path("volume");

        Map<LocalDate, PriceBar> byDate = new TreeMap<>();
        for (int i = 0; i < timestamps.size(); i++) {
            if (missing(open, i) || missing(high, i) || missing(low, i) || missing(close, i) || missing(volume, i)) {
                continue;
            }
            LocalDate date = Instant.ofEpochSecond(timestamps.get(i).asLong()).atZone(zone).toLocalDate();
            byDate.put(date, PriceBar.builder()
                .date(date)
                .open(open.get(i).asDouble())
                .high(high.get(i).asDouble())
                .low(low.get(i).asDouble())
                .close(close.get(i).asDouble())
                .volume(volume.get(i).asLong())
                .build());
        }
        return new ArrayList<>(byDate.values());
    }

    private ZoneId zoneOf(JsonNode meta) {
        String name = meta.path("exchangeTimezoneName").asText("");
        if (name.isEmpty()) return exchangeZone;
        try {
            return ZoneId.of(name);
        } catch (DateTimeException e) {
            log.debug("Unknown exchange zone '{}', using {}", name, exchangeZone);
            return exchangeZone;
        }
    }

    private static boolean missing(JsonNode column, int i) {
        JsonNode v = column.get(i);
        return v == null || v.isNull() || !v.isNumber();
    }
}
