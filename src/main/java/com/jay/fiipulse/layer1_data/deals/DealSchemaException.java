package com.jay.fiipulse.layer1_data.deals;

import java.util.List;

/** Raised when a deal payload has no column that resolves to a canonical field we cannot do without. */
public class DealSchemaException extends Exception {

    private final List<String> columns;

    public DealSchemaException(String field, List<String> columns) {
        super(field + " column missing; raw columns " + columns);
        this.columns = List.copyOf(columns);
    }

    public List<String> getColumns() {
        return columns;
    }
}
