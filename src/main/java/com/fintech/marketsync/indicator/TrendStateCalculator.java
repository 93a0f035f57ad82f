package com.fintech.marketsync.indicator;

/**
 * Trend state from moving-average cycle alignment combined with a Bollinger band-width
 * regime. States: 2 strong up, -2 strong down, 0 neutral; the band-width regime also
 * uses -1 for squeeze.
 *
 * Inputs are per-bar arrays with NaN where a value is not yet available.
 */
final class TrendStateCalculator {

    static final int PIVOT_LEFT = 20;
    static final int PIVOT_RIGHT = 20;
    private static final double PIVOT_MULTIPLIER = 0.7;
    private static final double DEFAULT_PIVOT_LEVEL = 5.0;

    private TrendStateCalculator() {
    }

    static boolean cycleBull(double fast, double mid, double slow) {
        if (Double.isNaN(fast) || Double.isNaN(mid) || Double.isNaN(slow)) {
            return false;
        }
        return (fast > mid && mid > slow) || (mid > fast && fast > slow);
    }

    static boolean cycleBear(double fast, double mid, double slow) {
        if (Double.isNaN(fast) || Double.isNaN(mid) || Double.isNaN(slow)) {
            return false;
        }
        return slow > mid && mid > fast;
    }

    /**
     * Band-width regime per bar.
     *
     * @param bbw band width (upper - lower) * 10 / basis
     * @param bbr band position (close - lower) / (upper - lower)
     */
    static int[] bandStates(double[] bbw, double[] bbr) {
        int n = bbw.length;
        int[] states = new int[n];
        double highPivotAvg = pivotAverage(bbw, true);
        double lowPivotAvg = pivotAverage(bbw, false);
        double buzz = highPivotAvg * PIVOT_MULTIPLIER;
        double squeeze = lowPivotAvg / PIVOT_MULTIPLIER;

        for (int i = 1; i < n; i++) {
            if (Double.isNaN(bbw[i]) || Double.isNaN(bbw[i - 1]) || Double.isNaN(bbr[i])
                    || Double.isNaN(buzz) || Double.isNaN(squeeze)) {
                states[i] = states[i - 1];
                continue;
            }
            boolean crossedBuzz = bbw[i] > buzz && bbw[i - 1] <= buzz;
            if (crossedBuzz && bbr[i] > 0.5) {
                states[i] = 2;
            } else if (crossedBuzz && bbr[i] < 0.5) {
                states[i] = -2;
            } else if (bbw[i] < squeeze) {
                states[i] = -1;
            } else {
                states[i] = states[i - 1];
            }

            if (states[i] == 2 && bbr[i] < 0.2) {
                states[i] = -2;
            }
            if (states[i] == -2 && bbr[i] > 0.8) {
                states[i] = 2;
            }

            boolean directional = states[i] == 2 || states[i] == -2;
            if ((directional && isFalling(bbw, i, 3))
                    || (bbw[i] > lowPivotAvg && states[i] == -1 && bbw[i] > bbw[i - 1])) {
                states[i] = 0;
            }
        }
        return states;
    }

    static int[] trendStates(boolean[] bull, boolean[] bear, int[] bandStates) {
        int n = bandStates.length;
        int[] trend = new int[n];
        for (int i = 1; i < n; i++) {
            int prev = trend[i - 1];
            if (bull[i] && bandStates[i] == 2) {
                trend[i] = 2;
            } else if (prev == 2 && !bull[i]) {
                trend[i] = 0;
            } else if (bear[i] && bandStates[i] == -2) {
                trend[i] = -2;
            } else if (prev == -2 && !bear[i]) {
                trend[i] = 0;
            } else {
                trend[i] = prev;
            }
        }
        return trend;
    }

    /** Strictly decreasing over the last length bars ending at index. */
    private static boolean isFalling(double[] values, int index, int length) {
        if (index - length + 1 < 0) {
            return false;
        }
        for (int j = index - length + 2; j <= index; j++) {
            if (Double.isNaN(values[j]) || Double.isNaN(values[j - 1]) || !(values[j] < values[j - 1])) {
                return false;
            }
        }
        return true;
    }

    private static double pivotAverage(double[] values, boolean high) {
        double sum = 0;
        int count = 0;
        double extreme = high ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                continue;
            }
            extreme = high ? Math.max(extreme, values[i]) : Math.min(extreme, values[i]);
            if (isPivot(values, i, high)) {
                sum += values[i];
                count++;
            }
        }
        if (count > 0) {
            return sum / count;
        }
        if (Double.isInfinite(extreme)) {
            return Double.NaN;
        }
        return high ? Math.max(extreme, DEFAULT_PIVOT_LEVEL) : Math.min(extreme, DEFAULT_PIVOT_LEVEL);
    }

    private static boolean isPivot(double[] values, int i, boolean high) {
        if (i - PIVOT_LEFT < 0 || i + PIVOT_RIGHT >= values.length) {
            return false;
        }
        double v = values[i];
        for (int j = i - PIVOT_LEFT; j <= i + PIVOT_RIGHT; j++) {
            if (j == i) {
                continue;
            }
            double other = values[j];
            if (Double.isNaN(other)) {
                return false;
            }
            if (high ? other >= v : other <= v) {
                return false;
            }
        }
        return true;
    }
}
