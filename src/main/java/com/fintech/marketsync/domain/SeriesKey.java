package com.fintech.marketsync.domain;

import java.util.Objects;

/**
 * Identifies one candle series: instrument plus timeframe code.
 */
public record SeriesKey(String symbol, String timeframe) {

    public SeriesKey {
        Objects.requireNonNull(symbol, "symbol cannot be null");
        Objects.requireNonNull(timeframe, "timeframe cannot be null");
    }

    public static SeriesKey of(String symbol, int minutes) {
        return new SeriesKey(symbol, Timeframe.toCode(minutes));
    }

    public int minutes() {
        return Timeframe.toMinutes(timeframe);
    }

    @Override
    public String toString() {
        return symbol + ":" + timeframe;
    }
}
