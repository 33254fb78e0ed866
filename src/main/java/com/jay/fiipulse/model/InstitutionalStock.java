package com.jay.fiipulse.model;

import com.jay.fiipulse.model.enums.CashAction;
import lombok.Builder;
import lombok.Value;

/** A security seen in the deal window, with the last-seen FII and DII cash actions. */
@Value
@Builder(toBuilder = true)
public class InstitutionalStock {
    String symbol;           // exchange symbol, e.g. POWERGRID
    String name;
    @Builder.Default
    CashAction fiiCash = CashAction.NEUTRAL;
    @Builder.Default
    CashAction diiCash = CashAction.NEUTRAL;
}
