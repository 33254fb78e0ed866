package com.jay.fiipulse.layer1_data.deals;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns one historical-deals response body into raw rows keyed by the provider's own headers.
 *
 * The endpoint answers with CSV or JSON depending on its mood. JSON comes either as a bare list
 * of row objects, or as an object holding the rows under one of several keys, optionally with a
 * {@code columns} array when the rows are positional.
 */
public class NsePayloadParser {

    private static final List<String> DATA_KEYS = List.of(
        "data", "Data", "results", "bulkDeals", "blockDeals",
        "deals", "bulkDealData", "blockDealData", "records");

    private final ObjectMapper objectMapper;

    public NsePayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record Payload(List<String> columns, List<Map<String, String>> rows) {
        public static Payload empty() {
            return new Payload(List.of(), List.of());
        }

        public boolean isEmpty() {
            return rows.isEmpty();
        }
    }

    public static boolean looksLikeJson(String body) {
        String t = stripBom(body).stripLeading();
        return t.startsWith("{") || t.startsWith("[");
    }

    public Payload parse(String body) throws IOException {
        String text = stripBom(body).strip();
        if (text.isEmpty()) return Payload.empty();
        return looksLikeJson(text) ? parseJson(text) : parseCsv(text);
    }

    // ── JSON ──────────────────────────────────────────────────────────────────

    Payload parseJson(String text) throws IOException {
        JsonNode root = objectMapper.readTree(text);
        if (root.isArray()) {
            return fromObjects(root);
        }
        if (!root.isObject()) return Payload.empty();

        JsonNode columns = root.has("columns") ? root.get("columns") : root.path("Columns");
        for (String key : DATA_KEYS) {
            JsonNode val = root.get(key);
            if (val == null || !val.isArray() || val.isEmpty()) continue;
            if (columns.isArray() && !val.get(0).isObject()) {
                return fromPositional(columns, val);
            }
            return fromObjects(val);
        }
        return Payload.empty();
    }

    private Payload fromObjects(JsonNode array) {
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, String>> rows = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isObject()) continue;
            Map<String, String> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                columns.add(f.getKey());
                row.put(f.getKey(), f.getValue().isNull() ? "" : f.getValue().asText(""));
            }
            rows.add(row);
        }
        return new Payload(new ArrayList<>(columns), rows);
    }

    private Payload fromPositional(JsonNode columnsNode, JsonNode array) {
        List<String> columns = new ArrayList<>();
        columnsNode.forEach(c -> columns.add(c.asText()));
        List<Map<String, String>> rows = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isArray()) continue;
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size() && i < item.size(); i++) {
                JsonNode v = item.get(i);
                row.put(columns.get(i), v.isNull() ? "" : v.asText(""));
            }
            rows.add(row);
        }
        return new Payload(columns, rows);
    }

    // ── CSV ───────────────────────────────────────────────────────────────────

    Payload parseCsv(String text) throws IOException {
        List<String[]> lines;
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(text)).build()) {
            lines = reader.readAll();
        } catch (CsvException e) {
            throw new IOException("Malformed deals CSV at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        }
        if (lines.isEmpty()) return Payload.empty();

        List<String> columns = new ArrayList<>();
        for (String h : lines.get(0)) columns.add(stripBom(h).trim());

        List<Map<String, String>> rows = new ArrayList<>();
        for (int r = 1; r < lines.size(); r++) {
            String[] cells = lines.get(r);
            if (cells.length == 1 && cells[0].isBlank()) continue;
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size() && i < cells.length; i++) {
                row.put(columns.get(i), cells[i].trim());
            }
            rows.add(row);
        }
        return new Payload(columns, rows);
    }

    private static String stripBom(String s) {
        return s == null ? "" : s.replace("\uFEFF", "");
    }
}
