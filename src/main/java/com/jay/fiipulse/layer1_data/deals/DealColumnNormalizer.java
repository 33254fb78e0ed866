package com.jay.fiipulse.layer1_data.deals;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps the exchange's varying column headers onto the canonical deal schema
 * {SYMBOL, COMPANY, CLIENT, BUYSELL, QTY, PRICE, DATE}.
 *
 * Exact names are looked up first (API-style {@code BD_*} keys and the CSV's human-readable
 * headers), then substring rules act as a fallback. Each canonical target is claimed at most
 * once per column set, so two raw columns never collapse into the same name. Unmapped columns
 * keep their trimmed raw name.
 */
public final class DealColumnNormalizer {

    public static final String SYMBOL     = "SYMBOL";
    public static final String COMPANY    = "COMPANY";
    public static final String CLIENT     = "CLIENT";
    public static final String BUYSELL    = "BUYSELL";
    public static final String QTY        = "QTY";
    public static final String PRICE      = "PRICE";
    public static final String DATE       = "DATE";
    public static final String ORDER_DATE = "ORDER_DATE";
    public static final String REMARKS    = "REMARKS";

    private static final Map<String, String> EXACT = new LinkedHashMap<>();

    static {
        // JSON API keys
        EXACT.put("BD_SYMBOL",      SYMBOL);
        EXACT.put("BD_SCRIP_NAME",  COMPANY);
        EXACT.put("BD_CLIENT_NAME", CLIENT);
        EXACT.put("BD_BUY_SELL",    BUYSELL);
        EXACT.put("BD_QTY_TRD",     QTY);
        EXACT.put("BD_DT_DATE",     DATE);
        EXACT.put("BD_DT_ORDER",    ORDER_DATE);
        EXACT.put("BD_TP_WATP",     PRICE);
        EXACT.put("BD_REMARKS",     REMARKS);
        // block-deal variants
        EXACT.put("SCRIP_NAME",     COMPANY);
        EXACT.put("CLIENT_NAME",    CLIENT);
        EXACT.put("BUY_SELL",       BUYSELL);
        EXACT.put("QTY_TRD",        QTY);
        EXACT.put("TRADE_DATE",     DATE);
        EXACT.put("TRADE_PRICE",    PRICE);
        // CSV download headers
        EXACT.put("SECURITY NAME",  COMPANY);
        EXACT.put("CLIENT NAME",    CLIENT);
        EXACT.put("BUY/SELL",       BUYSELL);
        EXACT.put("QUANTITY TRADED", QTY);
        EXACT.put("TRADE PRICE / WGHT. AVG. PRICE", PRICE);
        // canonical names map to themselves
        for (String c : List.of(SYMBOL, COMPANY, CLIENT, BUYSELL, QTY, PRICE, DATE, ORDER_DATE, REMARKS)) {
            EXACT.put(c, c);
        }
    }

    private DealColumnNormalizer() {}

    /**
     * Returns raw header → resulting header for every input column, in input order.
     */
    public static Map<String, String> mapping(List<String> headers) {
        Map<String, String> result = new LinkedHashMap<>();
        Set<String> claimed = new HashSet<>();
        for (String raw : headers) {
            String trimmed = clean(raw);
            String target = resolve(trimmed.toUpperCase(), claimed);
            if (target != null) claimed.add(target);
            result.put(raw, target != null ? target : trimmed);
        }
        return result;
    }

    public static List<String> normalize(List<String> headers) {
        return new ArrayList<>(mapping(headers).values());
    }

    private static String resolve(String upper, Set<String> claimed) {
        String exact = EXACT.get(upper);
        if (exact != null) {
            return claimed.contains(exact) ? null : exact;
        }
        // CLIENT is tested before the name rules so BD_CLIENT_NAME never lands on COMPANY
        if (upper.contains("CLIENT") && !claimed.contains(CLIENT))          return CLIENT;
        if (upper.contains("PARTY") && !claimed.contains(CLIENT))           return CLIENT;
        if (upper.contains("SYMBOL") && !claimed.contains(SYMBOL))          return SYMBOL;
        if (upper.contains("SCRIP_NAME") && !claimed.contains(COMPANY))     return COMPANY;
        if (upper.contains("COMP") && !claimed.contains(COMPANY))           return COMPANY;
        if (upper.contains("BUY_SELL") && !claimed.contains(BUYSELL))       return BUYSELL;
        if (upper.contains("QTY") && !claimed.contains(QTY))                return QTY;
        if (upper.contains("PRICE") && !claimed.contains(PRICE))            return PRICE;
        return null;
    }

    private static String clean(String raw) {
        if (raw == null) return "";
        return raw.replace("\uFEFF", "").trim();
    }
}
