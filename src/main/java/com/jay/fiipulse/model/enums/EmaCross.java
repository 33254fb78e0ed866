package com.jay.fiipulse.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EmaCross {
    BULLISH("bullish"),
    BEARISH("bearish"),
    UNKNOWN("unknown");

    private final String label;

    EmaCross(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
