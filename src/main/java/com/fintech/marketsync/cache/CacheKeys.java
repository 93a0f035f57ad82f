package com.fintech.marketsync.cache;

/**
 * Cache key layout read by downstream consumers. Changing any of these breaks readers.
 */
public final class CacheKeys {

    public static final String STREAM_STATUS = "websocket_status";

    private CacheKeys() {
    }

    public static String rawSeries(String symbol, String timeframe) {
        return "candles:" + symbol + ":" + timeframe;
    }

    public static String indicatorSeries(String symbol, String timeframe) {
        return "candles_with_indicators:" + symbol + ":" + timeframe;
    }

    public static String currentCandle(String symbol, String timeframe) {
        return "current_candle:" + symbol + ":" + timeframe;
    }

    public static String latest(String symbol, String timeframe) {
        return "latest:" + symbol + ":" + timeframe;
    }

    public static String currentWithIndicators(String symbol, String timeframe) {
        return "current_candle_with_indicators:" + symbol + ":" + timeframe;
    }

    public static String latestWithIndicators(String symbol, String timeframe) {
        return "latest_with_indicators:" + symbol + ":" + timeframe;
    }

    public static String gaps(String symbol, String timeframe) {
        return "gaps:" + symbol + ":" + timeframe;
    }

    public static String lock(String taskKind, String symbol, String timeframe) {
        return "lock:" + taskKind + ":" + symbol + ":" + timeframe;
    }

    /** Lock for one unit tied to a bucket boundary, epoch seconds. */
    public static String lock(String taskKind, String symbol, String timeframe, long boundaryTs) {
        return lock(taskKind, symbol, timeframe) + ":" + boundaryTs;
    }

    public static String lock(String taskKind) {
        return "lock:" + taskKind;
    }

    public static String taskStatus(String taskKind, String symbol, String timeframe) {
        return "task_status:" + taskKind + ":" + symbol + ":" + timeframe;
    }

    public static String taskStatus(String taskKind) {
        return "task_status:" + taskKind;
    }
}
