package com.jay.fiipulse.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InstitutionalFlowSignal {
    BOTH_BUY("BOTH BUY"),
    FII_BUY("FII BUY"),
    DII_BUY("DII BUY"),
    BOTH_SELL("BOTH SELL"),
    BULK_BLOCK("BULK/BLOCK"),
    SELL("SELL");

    private final String label;

    InstitutionalFlowSignal(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
