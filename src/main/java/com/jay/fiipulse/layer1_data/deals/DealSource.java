package com.jay.fiipulse.layer1_data.deals;

import com.jay.fiipulse.model.DealRecord;

import java.util.List;

/**
 * One provider in the deal-source chain. Implementations never throw: every network, parse or
 * schema failure is logged and reported as an empty list so the chain can move on.
 */
public interface DealSource {

    /** Human-readable provider name shown in the report header. */
    String label();

    List<DealRecord> fetch();
}
