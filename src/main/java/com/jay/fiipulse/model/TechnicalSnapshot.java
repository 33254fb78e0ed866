package com.jay.fiipulse.model;

import com.jay.fiipulse.model.enums.BollingerLabel;
import com.jay.fiipulse.model.enums.EmaCross;
import com.jay.fiipulse.model.enums.OverallSignal;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Indicator values for one security, rounded for display.
 * Built once per run by the IndicatorEngine; a failed computation yields {@link #neutral()}.
 */
@Value
@Builder
public class TechnicalSnapshot {
    double rsi;
    double macd;
    double macdHistogram;
    EmaCross emaCross;
    BollingerLabel bollingerLabel;
    double adx;
    double stochasticRsi;
    double resistance1;
    double support1;
    double resistance2;
    double support2;
    double swingHigh;
    double swingLow;
    double lastPrice;
    int compositeScore;
    OverallSignal overallSignal;
    List<Double> sparkline;
    boolean dataOk;

    public static TechnicalSnapshot neutral() {
        return TechnicalSnapshot.builder()
            .rsi(50.0)
            .emaCross(EmaCross.UNKNOWN)
            .bollingerLabel(BollingerLabel.NOT_AVAILABLE)
            .overallSignal(OverallSignal.NOT_AVAILABLE)
            .sparkline(List.of())
            .dataOk(false)
            .build();
    }
}
