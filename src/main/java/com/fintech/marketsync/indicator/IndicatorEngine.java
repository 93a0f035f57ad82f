package com.fintech.marketsync.indicator;

import com.fintech.marketsync.domain.Candle;
import com.fintech.marketsync.domain.IndicatorCandle;

import java.util.List;

/**
 * Pure function from an ascending candle window to the same window with
 * indicator fields populated. Cross-timeframe fields are left unset; see
 * {@link AutoTrendResolver}.
 */
public interface IndicatorEngine {

    /** Smallest window the engine accepts. */
    int minimumCandles();

    /**
     * @throws InsufficientCandlesException if candles has fewer than {@link #minimumCandles()} entries
     */
    List<IndicatorCandle> compute(List<Candle> candles);
}
