package com.jay.fiipulse.model;

import java.util.List;

/** Deals returned by the first provider that produced data, with that provider's label. */
public record DealFetchResult(List<DealRecord> deals, String sourceLabel) {
}
