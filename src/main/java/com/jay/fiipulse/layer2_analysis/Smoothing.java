package com.jay.fiipulse.layer2_analysis;

import java.util.Arrays;

/**
 * Series arithmetic for the indicator engine. Arrays are oldest-first; {@code NaN} marks a
 * missing value and propagates the way a dataframe column would.
 */
public final class Smoothing {

    private Smoothing() {}

    /** Wilder smoothing factor for a 14-period indicator (centre of mass 13). */
    public static double wilderAlpha(int period) {
        return 1.0 / period;
    }

    public static double spanAlpha(int span) {
        return 2.0 / (span + 1);
    }

    /**
     * Recursive exponential average seeded by the first observation:
     * {@code avg_t = a * x_t + (1 - a) * avg_(t-1)}.
     * Leading missing values stay missing. A gap inside the series keeps decaying the old
     * average, so the first value after a gap weighs more than {@code a}.
     */
    public static double[] ewm(double[] values, double alpha) {
        double[] out = new double[values.length];
        if (values.length == 0) return out;

        double decay = 1.0 - alpha;
        double weighted = values[0];
        double oldWeight = 1.0;
        out[0] = weighted;
        for (int i = 1; i < values.length; i++) {
            double cur = values[i];
            boolean observed = !Double.isNaN(cur);
            if (!Double.isNaN(weighted)) {
                oldWeight *= decay;
                if (observed) {
                    if (weighted != cur) {
                        weighted = (oldWeight * weighted + alpha * cur) / (oldWeight + alpha);
                    }
                    oldWeight = 1.0;
                }
            } else if (observed) {
                weighted = cur;
            }
            out[i] = weighted;
        }
        return out;
    }

    /** First difference; element 0 is missing. */
    public static double[] diff(double[] values) {
        double[] out = new double[values.length];
        if (values.length == 0) return out;
        out[0] = Double.NaN;
        for (int i = 1; i < values.length; i++) {
            out[i] = values[i] - values[i - 1];
        }
        return out;
    }

    /** Element-wise {@code max(x, 0)}; missing stays missing. */
    public static double[] clipLower(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            out[i] = Double.isNaN(v) ? Double.NaN : Math.max(v, 0.0);
        }
        return out;
    }

    public static double[] negate(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = -values[i];
        return out;
    }

    public static double rollingMax(double[] values, int window, int end) {
        double[] w = window(values, window, end);
        if (w == null) return Double.NaN;
        return Arrays.stream(w).max().orElse(Double.NaN);
    }

    public static double rollingMin(double[] values, int window, int end) {
        double[] w = window(values, window, end);
        if (w == null) return Double.NaN;
        return Arrays.stream(w).min().orElse(Double.NaN);
    }

    public static double rollingMean(double[] values, int window, int end) {
        double[] w = window(values, window, end);
        if (w == null) return Double.NaN;
        return Arrays.stream(w).sum() / window;
    }

    /** Sample standard deviation (divisor n - 1). */
    public static double rollingStd(double[] values, int window, int end) {
        double[] w = window(values, window, end);
        if (w == null || window < 2) return Double.NaN;
        double mean = Arrays.stream(w).sum() / window;
        double ss = 0;
        for (double v : w) ss += (v - mean) * (v - mean);
        return Math.sqrt(ss / (window - 1));
    }

    /** Values {@code [end - window + 1, end]}, or null when the window is short or holds a gap. */
    private static double[] window(double[] values, int window, int end) {
        int start = end - window + 1;
        if (window <= 0 || start < 0 || end >= values.length) return null;
        double[] w = Arrays.copyOfRange(values, start, end + 1);
        for (double v : w) {
            if (Double.isNaN(v)) return null;
        }
        return w;
    }
}
