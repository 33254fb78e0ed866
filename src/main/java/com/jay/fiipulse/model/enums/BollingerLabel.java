package com.jay.fiipulse.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BollingerLabel {
    OVERBOUGHT("Overbought"),
    MID("Mid"),
    OVERSOLD("Oversold"),
    NOT_AVAILABLE("N/A");

    private final String label;

    BollingerLabel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Position of the last close inside the band, 0 = lower band, 1 = upper band. */
    public static BollingerLabel fromPosition(double position) {
        if (position > 0.8) return OVERBOUGHT;
        if (position < 0.2) return OVERSOLD;
        return MID;
    }
}
