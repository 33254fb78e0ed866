package com.jay.fiipulse.layer1_data.deals;

import com.jay.fiipulse.model.DealFetchResult;
import com.jay.fiipulse.model.DealRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Layer 1 — ordered deal-provider chain.
 * Providers are tried in {@code @Order} sequence; the first non-empty result wins.
 * The last provider is the reference fallback, which never comes back empty.
 */
@Slf4j
@Service
public class DealSourceChain {

    private final List<DealSource> sources;

    public DealSourceChain(List<DealSource> sources) {
        if (sources.isEmpty()) throw new IllegalArgumentException("At least one deal source is required");
        this.sources = List.copyOf(sources);
    }

    public DealFetchResult fetchDeals() {
        for (DealSource source : sources) {
            List<DealRecord> deals = safeFetch(source);
            if (!deals.isEmpty()) {
                log.info("Deal source '{}' — {} deals", source.label(), deals.size());
                return new DealFetchResult(List.copyOf(deals), source.label());
            }
            log.warn("Deal source '{}' returned nothing", source.label());
        }
        DealSource last = sources.get(sources.size() - 1);
        log.error("All deal sources exhausted — returning empty result from '{}'", last.label());
        return new DealFetchResult(List.of(), last.label());
    }

    public List<String> labels() {
        return sources.stream().map(DealSource::label).toList();
    }

    private static List<DealRecord> safeFetch(DealSource source) {
        try {
            List<DealRecord> deals = source.fetch();
            return deals != null ? deals : List.of();
        } catch (RuntimeException e) {
            log.warn("Deal source '{}' failed: {}", source.label(), e.getMessage());
            return List.of();
        }
    }
}
