package com.fintech.marketsync.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Candle augmented with indicator fields. Indicator values are null until enough
 * history exists for their period. The human-readable times are for observability
 * only and never used for ordering.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndicatorCandle(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume,
    boolean current,
    Double rsi,
    Double atr,
    Double ema7,
    Double ma20,
    Double ma200,
    Integer bbState,
    Integer trendState,
    Integer autoTrendState,
    String humanTime,
    String humanTimeLocal
) {

    public static IndicatorCandle fromCandle(Candle candle) {
        return new IndicatorCandle(candle.timestamp(), candle.open(), candle.high(), candle.low(),
            candle.close(), candle.volume(), candle.current(),
            null, null, null, null, null, null, null, null, null, null);
    }

    public Candle toCandle() {
        return new Candle(timestamp, open, high, low, close, volume, current);
    }

    public IndicatorCandle withAutoTrendState(int state) {
        return new IndicatorCandle(timestamp, open, high, low, close, volume, current,
            rsi, atr, ema7, ma20, ma200, bbState, trendState, state, humanTime, humanTimeLocal);
    }

    public IndicatorCandle withHumanTimes(String utc, String local) {
        return new IndicatorCandle(timestamp, open, high, low, close, volume, current,
            rsi, atr, ema7, ma20, ma200, bbState, trendState, autoTrendState, utc, local);
    }

    public int trendStateOrNeutral() {
        return trendState != null ? trendState : 0;
    }
}
