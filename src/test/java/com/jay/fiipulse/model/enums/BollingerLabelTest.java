package com.jay.fiipulse.model.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BollingerLabelTest {

    @Test
    void fromPosition_shouldUseStrictThresholds() {
        assertEquals(BollingerLabel.OVERBOUGHT, BollingerLabel.fromPosition(0.81));
        assertEquals(BollingerLabel.MID, BollingerLabel.fromPosition(0.8));
        assertEquals(BollingerLabel.MID, BollingerLabel.fromPosition(0.5));
        assertEquals(BollingerLabel.MID, BollingerLabel.fromPosition(0.2));
        assertEquals(BollingerLabel.OVERSOLD, BollingerLabel.fromPosition(0.19));
    }

    @Test
    void fromPosition_shouldLabelClosesOutsideBand() {
        assertEquals(BollingerLabel.OVERBOUGHT, BollingerLabel.fromPosition(1.4));
        assertEquals(BollingerLabel.OVERSOLD, BollingerLabel.fromPosition(-0.3));
        assertEquals("Oversold", BollingerLabel.OVERSOLD.label());
    }
}
