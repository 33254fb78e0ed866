package com.jay.fiipulse.model.enums;

/**
 * Exchange-disclosed large-trade categories. The option type is the value the NSE
 * historical deals endpoint expects in its {@code optionType} parameter.
 */
public enum DealCategory {
    BULK("bulk_deals"),
    BLOCK("block_deals");

    private final String optionType;

    DealCategory(String optionType) {
        this.optionType = optionType;
    }

    public String optionType() {
        return optionType;
    }

    public static DealCategory fromOptionType(String value) {
        for (DealCategory c : values()) {
            if (c.optionType.equalsIgnoreCase(value) || c.name().equalsIgnoreCase(value)) return c;
        }
        throw new IllegalArgumentException("Unknown deal category: " + value);
    }
}
