package com.jay.fiipulse.layer2_analysis;

import com.jay.fiipulse.layer3_signal.CompositeSignalClassifier;
import com.jay.fiipulse.model.PriceBar;
import com.jay.fiipulse.model.TechnicalSnapshot;
import com.jay.fiipulse.model.enums.BollingerLabel;
import com.jay.fiipulse.model.enums.EmaCross;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBar;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.DoubleNum;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Layer 2 — Indicator Engine.
 * Derives the daily indicator set for one security from about six months of bars.
 *
 * MACD and the EMA 20/50 crossover use ta4j, whose EMA is seeded with the first close.
 * RSI, ADX and Stochastic RSI need Wilder smoothing over series with missing leading values,
 * so they run on {@link Smoothing}. Values are rounded only when placed in the snapshot.
 *
 * Any failure (too few bars, an RSI with no price movement, a non-finite value) gives the
 * neutral snapshot with {@code dataOk=false}; this method never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndicatorEngine {

    public static final int MIN_BARS = 25;

    private static final int RSI_PERIOD = 14;
    private static final int ADX_PERIOD = 14;
    private static final int STOCH_WINDOW = 14;
    private static final int BB_WINDOW = 20;
    private static final double BB_WIDTH = 2.0;
    private static final int SWING_WINDOW = 120;
    private static final int SPARKLINE_BARS = 7;

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    private static final LocalTime SESSION_CLOSE = LocalTime.of(15, 30);

    private final CompositeSignalClassifier classifier;

    public TechnicalSnapshot compute(List<PriceBar> bars) {
        return compute("series", bars);
    }

    public TechnicalSnapshot compute(String symbol, List<PriceBar> bars) {
        try {
            return computeOrThrow(bars);
        } catch (IndicatorException e) {
            log.warn("  {}: {}", symbol, e.getMessage());
            return TechnicalSnapshot.neutral();
        } catch (RuntimeException e) {
            log.warn("  {}: indicator computation failed: {}", symbol, e.toString());
            return TechnicalSnapshot.neutral();
        }
    }

    TechnicalSnapshot computeOrThrow(List<PriceBar> bars) {
        if (bars == null || bars.size() < MIN_BARS) {
            throw new IndicatorException("Only " + (bars == null ? 0 : bars.size()) + " rows");
        }
        int n = bars.size();
        int last = n - 1;
        double[] c = new double[n];
        double[] h = new double[n];
        double[] lo = new double[n];
        for (int i = 0; i < n; i++) {
            PriceBar b = bars.get(i);
            c[i] = b.getClose();
            h[i] = b.getHigh();
            lo[i] = b.getLow();
        }
        double lc = c[last];

        // ── RSI(14) ────────────────────────────────────────────────────────────
        double[] rsiSeries = rsiSeries(c);
        double rsi = rsiSeries[last];
        if (Double.isNaN(rsi)) {
            throw new IndicatorException("RSI not computable: no price movement in the smoothing window");
        }

        // ── MACD(12,26,9) and EMA 20/50 ────────────────────────────────────────
        BarSeries series = buildSeries(bars);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        MACDIndicator macd = new MACDIndicator(close, 12, 26);
        EMAIndicator signalLine = new EMAIndicator(macd, 9);
        int end = series.getEndIndex();
        double macdVal = macd.getValue(end).doubleValue();
        double macdHist = macdVal - signalLine.getValue(end).doubleValue();

        double ema20 = new EMAIndicator(close, 20).getValue(end).doubleValue();
        double ema50 = new EMAIndicator(close, 50).getValue(end).doubleValue();
        EmaCross cross = ema20 > ema50 ? EmaCross.BULLISH : EmaCross.BEARISH;

        // ── Bollinger Bands(20, 2σ) ────────────────────────────────────────────
        double mid = Smoothing.rollingMean(c, BB_WINDOW, last);
        double sd = Smoothing.rollingStd(c, BB_WINDOW, last);
        double upper = mid + BB_WIDTH * sd;
        double lower = mid - BB_WIDTH * sd;
        double width = upper - lower;
        double position = (lc - lower) / (width != 0 ? width : 1);
        BollingerLabel bb = BollingerLabel.fromPosition(requireFinite("Bollinger position", position));

        // ── ADX(14) ────────────────────────────────────────────────────────────
        double adx = adx(h, lo, c)[last];

        // ── Stochastic RSI ─────────────────────────────────────────────────────
        double lowRsi = Smoothing.rollingMin(rsiSeries, STOCH_WINDOW, last);
        double highRsi = Smoothing.rollingMax(rsiSeries, STOCH_WINDOW, last);
        double range = highRsi - lowRsi;
        double stoch = range != 0 ? (rsi - lowRsi) / range : Double.NaN;
        double stochRounded = Double.isNaN(stoch) ? 0.5 : round(stoch, 2);

        // ── Pivot S/R and swing range ──────────────────────────────────────────
        double pivot = (h[last] + lo[last] + lc) / 3;
        double r1 = 2 * pivot - lo[last];
        double s1 = 2 * pivot - h[last];
        double r2 = pivot + (h[last] - lo[last]);
        double s2 = pivot - (h[last] - lo[last]);
        int swing = Math.min(SWING_WINDOW, n);
        double swingHigh = Smoothing.rollingMax(h, swing, last);
        double swingLow = Smoothing.rollingMin(lo, swing, last);

        List<Double> sparkline = new ArrayList<>();
        for (int i = Math.max(0, n - SPARKLINE_BARS); i < n; i++) {
            sparkline.add(round(requireFinite("close", c[i]), 2));
        }

        double rsiRounded = round(requireFinite("RSI", rsi), 1);
        double histRounded = round(requireFinite("MACD histogram", macdHist), 2);
        double adxRounded = round(requireFinite("ADX", adx), 1);
        CompositeSignalClassifier.Score score =
            classifier.score(rsiRounded, histRounded, cross, adxRounded, stochRounded);

        return TechnicalSnapshot.builder()
            .rsi(rsiRounded)
            .macd(round(requireFinite("MACD", macdVal), 2))
            .macdHistogram(histRounded)
            .emaCross(cross)
            .bollingerLabel(bb)
            .adx(adxRounded)
            .stochasticRsi(stochRounded)
            .resistance1(round(requireFinite("R1", r1), 2))
            .support1(round(requireFinite("S1", s1), 2))
            .resistance2(round(requireFinite("R2", r2), 2))
            .support2(round(requireFinite("S2", s2), 2))
            .swingHigh(round(requireFinite("swing high", swingHigh), 2))
            .swingLow(round(requireFinite("swing low", swingLow), 2))
            .lastPrice(round(lc, 2))
            .compositeScore(score.value())
            .overallSignal(score.signal())
            .sparkline(List.copyOf(sparkline))
            .dataOk(true)
            .build();
    }

    /**
     * RSI per bar. With zero average loss the RSI is 100 when there were gains, and undefined
     * when there was no movement at all.
     */
    static double[] rsiSeries(double[] close) {
        double[] delta = Smoothing.diff(close);
        double alpha = Smoothing.wilderAlpha(RSI_PERIOD);
        double[] avgGain = Smoothing.ewm(Smoothing.clipLower(delta), alpha);
        double[] avgLoss = Smoothing.ewm(Smoothing.clipLower(Smoothing.negate(delta)), alpha);
        double[] rsi = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            double ag = avgGain[i];
            double al = avgLoss[i];
            if (Double.isNaN(ag) || Double.isNaN(al)) {
                rsi[i] = Double.NaN;
            } else if (al == 0) {
                rsi[i] = ag > 0 ? 100.0 : Double.NaN;
            } else {
                rsi[i] = 100 - 100 / (1 + ag / al);
            }
        }
        return rsi;
    }

    /** Wilder ADX: smoothed DX built from the directional movement and true range. */
    static double[] adx(double[] high, double[] low, double[] close) {
        int n = close.length;
        double alpha = Smoothing.wilderAlpha(ADX_PERIOD);
        double[] plusDm = Smoothing.clipLower(Smoothing.diff(high));
        double[] minusDm = Smoothing.clipLower(Smoothing.negate(Smoothing.diff(low)));

        double[] tr = new double[n];
        for (int i = 0; i < n; i++) {
            double range = high[i] - low[i];
            if (i == 0) {
                tr[i] = range;
            } else {
                double prev = close[i - 1];
                tr[i] = Math.max(range, Math.max(Math.abs(high[i] - prev), Math.abs(low[i] - prev)));
            }
        }

        double[] atr = Smoothing.ewm(tr, alpha);
        double[] plusSmoothed = Smoothing.ewm(plusDm, alpha);
        double[] minusSmoothed = Smoothing.ewm(minusDm, alpha);
        double[] dx = new double[n];
        for (int i = 0; i < n; i++) {
            double pdi = 100 * plusSmoothed[i] / atr[i];
            double mdi = 100 * minusSmoothed[i] / atr[i];
            double sum = pdi + mdi;
            dx[i] = sum == 0 ? Double.NaN : 100 * Math.abs(pdi - mdi) / sum;
        }
        return Smoothing.ewm(dx, alpha);
    }

    private static BarSeries buildSeries(List<PriceBar> bars) {
        // BaseBar(double...) builds DoubleNum values; the series must store the same Num type
        BarSeries series = new BaseBarSeriesBuilder()
            .withName("daily")
            .withNumTypeOf(DoubleNum.class)
            .build();
        LocalDate previous = null;
        for (int i = 0; i < bars.size(); i++) {
            PriceBar bar = bars.get(i);
            LocalDate date = bar.getDate() != null ? bar.getDate() : LocalDate.EPOCH.plusDays(i);
            if (previous != null && !date.isAfter(previous)) {
                throw new IndicatorException("Bars out of order at " + date);
            }
            previous = date;
            ZonedDateTime endTime = ZonedDateTime.of(date, SESSION_CLOSE, IST);
            series.addBar(new BaseBar(Duration.ofDays(1), endTime,
                bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose(), bar.getVolume()));
        }
        return series;
    }

    private static double requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IndicatorException(name + " is not finite (" + value + ")");
        }
        return value;
    }

    static double round(double value, int scale) {
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }
}
