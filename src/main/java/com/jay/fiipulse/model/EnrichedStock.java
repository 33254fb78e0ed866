package com.jay.fiipulse.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.jay.fiipulse.model.enums.InstitutionalFlowSignal;
import lombok.Builder;
import lombok.Value;

/**
 * Final per-security record handed to the reporting layer.
 * Serialises flat: stock fields, then indicator fields, then the flow signal.
 */
@Value
@Builder
public class EnrichedStock {
    @JsonUnwrapped
    InstitutionalStock stock;
    @JsonUnwrapped
    TechnicalSnapshot technicals;
    InstitutionalFlowSignal flowSignal;
    boolean bothBuy;
    boolean fiiOnly;
    boolean diiOnly;
}
