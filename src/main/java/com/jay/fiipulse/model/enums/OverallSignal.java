package com.jay.fiipulse.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Composite technical signal. Ranks order the tradable signals from SELL (0) to
 * STRONG BUY (4); N/A has no rank and is only produced for failed snapshots.
 */
public enum OverallSignal {
    SELL("SELL", 0),
    CAUTION("CAUTION", 1),
    NEUTRAL("NEUTRAL", 2),
    BUY("BUY", 3),
    STRONG_BUY("STRONG BUY", 4),
    NOT_AVAILABLE("N/A", -1);

    private final String label;
    private final int rank;

    OverallSignal(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int rank() {
        return rank;
    }

    public static OverallSignal fromScore(int score) {
        if (score >= 5)  return STRONG_BUY;
        if (score >= 3)  return BUY;
        if (score >= 0)  return NEUTRAL;
        if (score >= -2) return CAUTION;
        return SELL;
    }
}
