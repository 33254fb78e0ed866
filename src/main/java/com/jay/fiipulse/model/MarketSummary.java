package com.jay.fiipulse.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/** Benchmark snapshot shared read-only by every record of a run (NIFTY 50, SENSEX). */
@Value
@Builder
public class MarketSummary {
    @Singular
    List<IndexQuote> indices;
    LocalDateTime fetchedAt;
}
