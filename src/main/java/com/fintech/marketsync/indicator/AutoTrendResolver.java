package com.fintech.marketsync.indicator;

import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.IndicatorCandle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fills the cross-timeframe trend field from a coarser timeframe's already computed
 * indicator series for the same symbol.
 */
@Component
public class AutoTrendResolver {

    static final int NEUTRAL = 0;

    private final Map<Integer, Integer> sources;
    private final List<Integer> configuredTimeframes;
    private final int minCandles;

    public AutoTrendResolver(MarketDataProperties properties) {
        this.sources = properties.getIndicators().getAutoTrendSource();
        this.configuredTimeframes = properties.getTimeframes();
        this.minCandles = properties.getIndicators().getAutoTrendMinCandles();
    }

    /** Coarser timeframe minutes the given timeframe depends on, if it is configured. */
    public Optional<Integer> sourceTimeframe(int minutes) {
        Integer source = sources.get(minutes);
        if (source == null || source <= minutes || !configuredTimeframes.contains(source)) {
            return Optional.empty();
        }
        return Optional.of(source);
    }

    /**
     * Copies the trend state of the coarser bucket containing each candle.
     * A coarse series shorter than the minimum yields the neutral state for every candle.
     *
     * @param candles ascending finer-timeframe candles
     * @param source ascending coarser-timeframe indicator series, may be empty
     */
    public List<IndicatorCandle> apply(List<IndicatorCandle> candles, List<IndicatorCandle> source) {
        List<IndicatorCandle> result = new ArrayList<>(candles.size());
        if (source.size() < minCandles) {
            candles.forEach(c -> result.add(c.withAutoTrendState(NEUTRAL)));
            return result;
        }
        int cursor = -1;
        for (IndicatorCandle candle : candles) {
            while (cursor + 1 < source.size() && source.get(cursor + 1).timestamp() <= candle.timestamp()) {
                cursor++;
            }
            int state = cursor >= 0 ? source.get(cursor).trendStateOrNeutral() : NEUTRAL;
            result.add(candle.withAutoTrendState(state));
        }
        return result;
    }
}
