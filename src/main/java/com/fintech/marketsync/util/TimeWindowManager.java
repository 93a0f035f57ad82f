package com.fintech.marketsync.util;

import com.fintech.marketsync.domain.Timeframe;

/**
 * Time window calculations for the polling cadence: bar-end detection,
 * in-progress candle detection, and refresh intervals.
 *
 * Thread-safe and stateless - all methods are pure functions.
 */
public class TimeWindowManager {

    private final int barEndOffsetSeconds;
    private final int barEndWindowSeconds;

    public TimeWindowManager(int barEndOffsetSeconds, int barEndWindowSeconds) {
        this.barEndOffsetSeconds = barEndOffsetSeconds;
        this.barEndWindowSeconds = barEndWindowSeconds;
    }

    /**
     * True during the short window right after a timeframe boundary when the
     * exchange has closed the previous bar: offset <= seconds-into-bucket < offset + window.
     *
     * @param nowMs Wall clock in epoch millis
     * @param minutes Timeframe width
     */
    public boolean isBarEnd(long nowMs, int minutes) {
        long bucketStartMs = Timeframe.align(nowMs, minutes) * 1000L;
        long secondsInto = (nowMs - bucketStartMs) / 1000L;
        return secondsInto >= barEndOffsetSeconds && secondsInto < barEndOffsetSeconds + barEndWindowSeconds;
    }

    /**
     * Refresh interval for the in-progress candle. Short timeframes refresh
     * more often.
     */
    public long currentRefreshIntervalSeconds(int minutes) {
        if (minutes <= 1) {
            return 5;
        }
        if (minutes <= 5) {
            return 10;
        }
        if (minutes <= 30) {
            return 20;
        }
        if (minutes <= 240) {
            return 30;
        }
        return 60;
    }

    /** True while the bucket starting at candleTs (seconds) has not closed at nowMs. */
    public boolean isCurrent(long candleTs, int minutes, long nowMs) {
        return (candleTs + minutes * 60L) * 1000L > nowMs;
    }

    /**
     * Number of whole buckets between two epoch-second timestamps after alignment.
     */
    public long windowsBetween(long fromTs, long toTs, int minutes) {
        long step = minutes * 60L;
        long from = Math.floorDiv(fromTs, step) * step;
        long to = Math.floorDiv(toTs, step) * step;
        return (to - from) / step;
    }
}
