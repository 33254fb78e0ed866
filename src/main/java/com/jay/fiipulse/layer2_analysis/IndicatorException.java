package com.jay.fiipulse.layer2_analysis;

/** An indicator could not be computed from the bars supplied. */
public class IndicatorException extends RuntimeException {

    public IndicatorException(String message) {
        super(message);
    }
}
