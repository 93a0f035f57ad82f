package com.fintech.marketsync.indicator;

import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.Candle;
import com.fintech.marketsync.domain.IndicatorCandle;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Indicator engine backed by ta4j.
 *
 * <p>Populates RSI(14), ATR(14), EMA(7), SMA(20), SMA(200), the Bollinger band-width
 * regime and the trend state. A value stays null until its period is covered.
 */
@Component
public class Ta4jIndicatorEngine implements IndicatorEngine {

    static final int RSI_PERIOD = 14;
    static final int ATR_PERIOD = 14;
    static final int EMA_FAST = 7;
    static final int MA_MID = 20;
    static final int MA_SLOW = 200;
    static final int BB_PERIOD = 15;
    static final double BB_MULTIPLIER = 1.5;

    private final int minimumCandles;

    @Autowired
    public Ta4jIndicatorEngine(MarketDataProperties properties) {
        this(properties.getIndicators().getMinCandles());
    }

    Ta4jIndicatorEngine(int minimumCandles) {
        this.minimumCandles = minimumCandles;
    }

    @Override
    public int minimumCandles() {
        return minimumCandles;
    }

    @Override
    public List<IndicatorCandle> compute(List<Candle> candles) {
        if (candles.size() < minimumCandles) {
            throw new InsufficientCandlesException(candles.size(), minimumCandles);
        }
        BarSeries series = toSeries(candles);
        int n = series.getBarCount();

        ClosePriceIndicator close = new ClosePriceIndicator(series);
        RSIIndicator rsi = new RSIIndicator(close, RSI_PERIOD);
        ATRIndicator atr = new ATRIndicator(series, ATR_PERIOD);
        EMAIndicator ema7 = new EMAIndicator(close, EMA_FAST);
        SMAIndicator ma20 = new SMAIndicator(close, MA_MID);
        SMAIndicator ma200 = new SMAIndicator(close, MA_SLOW);
        SMAIndicator basis = new SMAIndicator(close, BB_PERIOD);
        StandardDeviationIndicator deviation = new StandardDeviationIndicator(close, BB_PERIOD);

        double[] fast = values(ema7, n, EMA_FAST);
        double[] mid = values(ma20, n, MA_MID);
        double[] slow = values(ma200, n, MA_SLOW);
        double[] basisValues = values(basis, n, BB_PERIOD);
        double[] deviationValues = values(deviation, n, BB_PERIOD);

        double[] bbw = new double[n];
        double[] bbr = new double[n];
        boolean[] bull = new boolean[n];
        boolean[] bear = new boolean[n];
        for (int i = 0; i < n; i++) {
            double dev = BB_MULTIPLIER * deviationValues[i];
            double upper = basisValues[i] + dev;
            double lower = basisValues[i] - dev;
            double width = upper - lower;
            bbw[i] = basisValues[i] != 0 ? width * 10 / basisValues[i] : Double.NaN;
            bbr[i] = width != 0 ? (candles.get(i).close() - lower) / width : Double.NaN;
            bull[i] = TrendStateCalculator.cycleBull(fast[i], mid[i], slow[i]);
            bear[i] = TrendStateCalculator.cycleBear(fast[i], mid[i], slow[i]);
        }
        int[] bandStates = TrendStateCalculator.bandStates(bbw, bbr);
        int[] trendStates = TrendStateCalculator.trendStates(bull, bear, bandStates);

        double[] rsiValues = values(rsi, n, RSI_PERIOD + 1);
        double[] atrValues = values(atr, n, ATR_PERIOD + 1);

        List<IndicatorCandle> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Candle c = candles.get(i);
            result.add(new IndicatorCandle(
                c.timestamp(), c.open(), c.high(), c.low(), c.close(), c.volume(), c.current(),
                boxed(rsiValues[i]),
                boxed(atrValues[i]),
                boxed(fast[i]),
                boxed(mid[i]),
                boxed(slow[i]),
                bandStates[i],
                trendStates[i],
                null,
                null,
                null
            ));
        }
        return result;
    }

    private static BarSeries toSeries(List<Candle> candles) {
        BarSeries series = new BaseBarSeriesBuilder().withName("indicator-window").build();
        long previous = Long.MIN_VALUE;
        for (Candle c : candles) {
            if (c.timestamp() <= previous) {
                throw new IllegalArgumentException(
                    "Indicator window must be strictly ascending: " + c.timestamp() + " after " + previous);
            }
            previous = c.timestamp();
            ZonedDateTime endTime = ZonedDateTime.ofInstant(Instant.ofEpochSecond(c.timestamp()), ZoneOffset.UTC);
            series.addBar(endTime, c.open(), c.high(), c.low(), c.close(), c.volume());
        }
        return series;
    }

    /** Indicator values with NaN before the first index the period fully covers. */
    private static double[] values(Indicator<Num> indicator, int n, int period) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            if (i < period - 1) {
                out[i] = Double.NaN;
                continue;
            }
            Num value = indicator.getValue(i);
            out[i] = value == null || value.isNaN() ? Double.NaN : value.doubleValue();
        }
        return out;
    }

    private static Double boxed(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    }
}
