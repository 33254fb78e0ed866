package com.jay.fiipulse.layer3_signal;

import com.jay.fiipulse.model.InstitutionalStock;
import com.jay.fiipulse.model.enums.CashAction;
import com.jay.fiipulse.model.enums.EmaCross;
import com.jay.fiipulse.model.enums.InstitutionalFlowSignal;
import com.jay.fiipulse.model.enums.OverallSignal;
import org.springframework.stereotype.Component;

/**
 * Layer 3 — Composite Signal Classifier.
 *
 * Additive score over the rounded indicator values; every rule contributes:
 *   RSI          +2 below 40, +1 below 55, -2 above 70
 *   MACD hist    +2 when positive
 *   EMA 20/50    +2 when bullish
 *   ADX          +1 above 25 (trending)
 *   Stoch RSI    +1 below 0.3, -1 above 0.8
 * The total maps onto {@link OverallSignal#fromScore(int)}.
 *
 * The institutional-flow label is derived from the FII/DII cash actions and is not scored.
 */
@Component
public class CompositeSignalClassifier {

    public record Score(int value, OverallSignal signal) {}

    public Score score(double rsi, double macdHistogram, EmaCross emaCross, double adx, double stochasticRsi) {
        int sc = 0;

        if (rsi < 40)      sc += 2;
        else if (rsi < 55) sc += 1;
        else if (rsi > 70) sc -= 2;

        if (macdHistogram > 0) sc += 2;

        if (emaCross == EmaCross.BULLISH) sc += 2;

        if (adx > 25) sc += 1;

        if (stochasticRsi < 0.3)      sc += 1;
        else if (stochasticRsi > 0.8) sc -= 1;

        return new Score(sc, OverallSignal.fromScore(sc));
    }

    public InstitutionalFlowSignal flowSignal(InstitutionalStock stock) {
        return flowSignal(stock.getFiiCash(), stock.getDiiCash());
    }

    /** Mixed combinations (one side selling, the other neutral or selling) fall into SELL. */
    public InstitutionalFlowSignal flowSignal(CashAction fii, CashAction dii) {
        boolean fiiBuy = fii == CashAction.BUY;
        boolean diiBuy = dii == CashAction.BUY;
        if (fiiBuy && diiBuy) return InstitutionalFlowSignal.BOTH_BUY;
        if (fiiBuy)           return InstitutionalFlowSignal.FII_BUY;
        if (diiBuy)           return InstitutionalFlowSignal.DII_BUY;
        if (fii == CashAction.SELL && dii == CashAction.SELL) return InstitutionalFlowSignal.BOTH_SELL;
        if (fii == CashAction.NEUTRAL && dii == CashAction.NEUTRAL) return InstitutionalFlowSignal.BULK_BLOCK;
        return InstitutionalFlowSignal.SELL;
    }
}
