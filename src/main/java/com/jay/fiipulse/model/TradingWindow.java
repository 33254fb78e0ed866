package com.jay.fiipulse.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Inclusive disclosure window, {@code from} to {@code to}.
 * {@code complete} is false when fewer than the required trading days were found.
 */
public record TradingWindow(LocalDate from, LocalDate to, int tradingDays, boolean complete) {

    public static final DateTimeFormatter NSE_DATE = DateTimeFormatter.ofPattern("dd-MM-yyyy");

    public String fromParam() {
        return from.format(NSE_DATE);
    }

    public String toParam() {
        return to.format(NSE_DATE);
    }

    @JsonProperty("label")
    public String label() {
        return fromParam() + " → " + toParam();
    }
}
