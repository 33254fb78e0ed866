package com.jay.fiipulse.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Output of one run. Consumed read-only by the reporting layer (HTML page, email).
 */
@Value
@Builder
public class PulseReport {
    LocalDateTime generatedAt;
    String source;
    String windowLabel;
    MarketSummary market;
    List<EnrichedStock> stocks;

    // ── Header counters ──────────────────────────────────────────────────────
    int fiiBuyCount;
    int diiBuyCount;
    int bothBuyCount;
    int strongBuyCount;
}
