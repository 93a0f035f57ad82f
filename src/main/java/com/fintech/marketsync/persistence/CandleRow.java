package com.fintech.marketsync.persistence;

import com.fintech.marketsync.domain.IndicatorCandle;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Durable store row. Prices and volume are fixed-point; indicator columns are nullable.
 */
public record CandleRow(
    Instant time,
    String timeframe,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    Double rsi14,
    Double atr,
    Double ema7,
    Double ma20,
    Integer trendState,
    Integer autoTrendState
) {

    public static CandleRow from(IndicatorCandle candle, String timeframe) {
        return new CandleRow(
            Instant.ofEpochSecond(candle.timestamp()),
            timeframe,
            BigDecimal.valueOf(candle.open()),
            BigDecimal.valueOf(candle.high()),
            BigDecimal.valueOf(candle.low()),
            BigDecimal.valueOf(candle.close()),
            BigDecimal.valueOf(candle.volume()),
            candle.rsi(),
            candle.atr(),
            candle.ema7(),
            candle.ma20(),
            candle.trendState(),
            candle.autoTrendState()
        );
    }
}
