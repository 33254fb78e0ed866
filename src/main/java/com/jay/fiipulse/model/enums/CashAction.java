package com.jay.fiipulse.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Net cash-market action of one investor class in a security over the deal window. */
public enum CashAction {
    BUY("buy"),
    SELL("sell"),
    NEUTRAL("neutral");

    private final String label;

    CashAction(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static CashAction fromLabel(String value) {
        if (value == null) return NEUTRAL;
        for (CashAction a : values()) {
            if (a.label.equalsIgnoreCase(value.trim())) return a;
        }
        return NEUTRAL;
    }

    /** "B", "BUY", "Bought" are buys; anything else is a sell. */
    public static CashAction fromBuySellFlag(String flag) {
        return flag != null && flag.trim().toUpperCase().startsWith("B") ? BUY : SELL;
    }
}
