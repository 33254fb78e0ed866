package com.jay.fiipulse.model;

/** Last close and day-over-day change of a benchmark index. */
public record IndexQuote(String name, String ticker, double price, double changePct) {

    public static IndexQuote unavailable(String name, String ticker) {
        return new IndexQuote(name, ticker, 0, 0);
    }
}
