package com.jay.fiipulse.layer1_data.deals;

import com.jay.fiipulse.model.DealRecord;
import com.jay.fiipulse.model.enums.DealCategory;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Converts raw provider rows into canonical {@link DealRecord}s using the normalised header
 * mapping. Rows without a symbol or client name are dropped.
 */
@Slf4j
public final class DealRowMapper {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        caseInsensitive("dd-MMM-yyyy"),
        caseInsensitive("dd-MM-yyyy"),
        caseInsensitive("d-MMM-yyyy"),
        DateTimeFormatter.ISO_LOCAL_DATE,
        caseInsensitive("dd MMM yyyy"));

    private DealRowMapper() {}

    /**
     * @param rows     raw rows keyed by provider header
     * @param mapping  raw header → canonical header, from {@link DealColumnNormalizer#mapping}
     * @param categoryOf deal category each row was fetched under, same order as {@code rows}
     */
    public static List<DealRecord> toDeals(List<Map<String, String>> rows,
                                           Map<String, String> mapping,
                                           List<DealCategory> categoryOf) throws DealSchemaException {
        if (!mapping.containsValue(DealColumnNormalizer.CLIENT)) {
            throw new DealSchemaException(DealColumnNormalizer.CLIENT, new ArrayList<>(mapping.keySet()));
        }
        List<DealRecord> deals = new ArrayList<>();
        int dropped = 0;
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> canonical = rename(rows.get(i), mapping);
            String symbol = canonical.getOrDefault(DealColumnNormalizer.SYMBOL, "").trim().toUpperCase();
            String client = canonical.getOrDefault(DealColumnNormalizer.CLIENT, "").trim().toUpperCase();
            if (symbol.isEmpty() || client.isEmpty()) {
                dropped++;
                continue;
            }
            String company = canonical.getOrDefault(DealColumnNormalizer.COMPANY, "").trim();
            deals.add(DealRecord.builder()
                .symbol(symbol)
                .companyName(company.isEmpty() ? symbol : company)
                .clientName(client)
                .buySell(canonical.getOrDefault(DealColumnNormalizer.BUYSELL, "").trim().toUpperCase())
                .quantity((long) parseNumber(canonical.get(DealColumnNormalizer.QTY)))
                .price(parseNumber(canonical.get(DealColumnNormalizer.PRICE)))
                .tradeDate(parseDate(canonical.get(DealColumnNormalizer.DATE)).orElse(null))
                .category(categoryOf.get(i))
                .build());
        }
        if (dropped > 0) log.debug("Dropped {} rows without symbol or client", dropped);
        return deals;
    }

    private static Map<String, String> rename(Map<String, String> row, Map<String, String> mapping) {
        Map<String, String> out = new LinkedHashMap<>();
        row.forEach((k, v) -> out.putIfAbsent(mapping.getOrDefault(k, k.trim()), v));
        return out;
    }

    static double parseNumber(String raw) {
        if (raw == null) return 0;
        String cleaned = raw.replace(",", "").trim();
        if (cleaned.isEmpty() || cleaned.equals("-")) return 0;
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static Optional<LocalDate> parseDate(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String v = raw.trim();
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(v, f));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        log.debug("Unparseable trade date '{}'", v);
        return Optional.empty();
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
    }
}
