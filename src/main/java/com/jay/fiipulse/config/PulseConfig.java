package com.jay.fiipulse.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Loads and exposes all configuration from config.yaml, plus the versioned
 * reference tables (holidays, investor keywords, fallback stocks) from reference-data.yaml.
 * Values are read once at startup. Edit the YAML and restart to apply changes.
 */
@Slf4j
@Component
public class PulseConfig {

    @Value("${pulse.config-file:config.yaml}")
    private String configFile = "config.yaml";

    @Value("${pulse.reference-file:reference-data.yaml}")
    private String referenceFile = "reference-data.yaml";

    @Autowired(required = false)
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null) return null;
        return PLACEHOLDER_HELPER.replacePlaceholders(value,
            key -> env != null ? env.getProperty(key) : System.getenv(key));
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Calendar calendar = new Calendar();
    private Nse nse = new Nse();
    private Scrape scrape = new Scrape();
    private Price price = new Price();
    private Market market = new Market();
    private Classifier classifier = new Classifier();
    private ReferenceData reference = new ReferenceData();

    @PostConstruct
    public void load() {
        ObjectMapper mapper = yamlMapper();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
            } else {
                ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
                this.calendar   = root.getCalendar();
                this.nse        = root.getNse();
                this.scrape     = root.getScrape();
                this.price      = root.getPrice();
                this.market     = root.getMarket();
                this.classifier = root.getClassifier();

                this.nse.setLandingUrl(resolve(this.nse.getLandingUrl()));
                this.nse.setApiUrl(resolve(this.nse.getApiUrl()));
                this.scrape.setUrl(resolve(this.scrape.getUrl()));
                this.price.setChartUrl(resolve(this.price.getChartUrl()));
                log.info("PulseConfig loaded from '{}'. Cutoff {} {}, {} price workers",
                    configFile, calendar.getCutoffTime(), calendar.getZone(), price.getWorkers());
            }
        } catch (IOException e) {
            log.error("Failed to load {} — using defaults: {}", configFile, e.getMessage());
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(referenceFile)) {
            if (is == null) {
                log.warn("Reference data '{}' not found on classpath — tables are empty", referenceFile);
                return;
            }
            this.reference = mapper.readValue(is, ReferenceData.class);
            log.info("Reference data v{}: {} holiday years, {} FII / {} DII keywords, {} fallback stocks",
                reference.getVersion(), reference.getHolidays().size(),
                reference.getFiiKeywords().size(), reference.getDiiKeywords().size(),
                reference.getFallbackStocks().size());
        } catch (IOException e) {
            log.error("Failed to load {} — tables are empty: {}", referenceFile, e.getMessage());
        }
    }

    static ObjectMapper yamlMapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.findAndRegisterModules();
        return mapper;
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Calendar calendar()         { return calendar; }
    public Nse nse()                   { return nse; }
    public Scrape scrape()             { return scrape; }
    public Price price()               { return price; }
    public Market market()             { return market; }
    public Classifier classifier()     { return classifier; }
    public ReferenceData reference()   { return reference; }

    /** All configured holidays across years, flattened. */
    public Set<LocalDate> holidays() {
        Set<LocalDate> all = new TreeSet<>();
        reference.getHolidays().values().forEach(all::addAll);
        return all;
    }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Calendar calendar = new Calendar();
        private Nse nse = new Nse();
        private Scrape scrape = new Scrape();
        private Price price = new Price();
        private Market market = new Market();
        private Classifier classifier = new Classifier();
    }

    @Data public static class Calendar {
        private String zone = "Asia/Kolkata";
        private LocalTime cutoffTime = LocalTime.of(18, 30);  // block-deal window closes
        private int toDateLookbackDays = 10;
        private int fromDateTradingSteps = 5;
        private int fromDateMaxCalendarDays = 30;
    }

    @Data public static class Nse {
        private String landingUrl = "https://www.nseindia.com/";
        private String warmupUrl = "https://www.nseindia.com/market-data/bulk-block-short-selling-deals";
        private String apiUrl = "https://www.nseindia.com/api/historicalOR/bulk-block-short-deals";
        private List<String> dealCategories = new ArrayList<>(List.of("bulk_deals", "block_deals"));
        private boolean requestCsv = true;
        private int connectTimeoutSeconds = 15;
        private int readTimeoutSeconds = 30;
        private int maxAttempts = 3;
        private long backoffMs = 3000;
        private long warmupPauseMs = 2000;
        private long categoryPauseMs = 1500;
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36";
    }

    @Data public static class Scrape {
        private String url = "https://munafasutra.com/nse/FIIDII/";
        private int rowLimit = 20;
        private int timeoutSeconds = 20;
    }

    @Data public static class Price {
        private String chartUrl = "https://query1.finance.yahoo.com/v8/finance/chart/";
        private int historyDays = 185;
        private String symbolSuffix = ".NS";
        private int timeoutSeconds = 15;
        private long requestDelayMs = 400;
        private int workers = 4;
    }

    @Data public static class Market {
        private int historyDays = 5;
        private List<Benchmark> indices = new ArrayList<>(List.of(
            new Benchmark("NIFTY 50", "^NSEI"),
            new Benchmark("SENSEX", "^BSESN")));
    }

    @Data public static class Benchmark {
        private String name;
        private String ticker;

        public Benchmark() {}

        public Benchmark(String name, String ticker) {
            this.name = name;
            this.ticker = ticker;
        }
    }

    @Data public static class Classifier {
        private boolean sortByTradeDate = false;
    }

    /** Versioned data tables; refreshed yearly (holidays) or as institutions change names. */
    @Data public static class ReferenceData {
        private String version = "unversioned";
        private Map<Integer, List<LocalDate>> holidays = new TreeMap<>();
        private List<String> fiiKeywords = new ArrayList<>();
        private List<String> diiKeywords = new ArrayList<>();
        private List<FallbackStock> fallbackStocks = new ArrayList<>();
    }

    @Data public static class FallbackStock {
        private String symbol;
        private String name;
        private String fii = "neutral";
        private String dii = "neutral";
    }
}
