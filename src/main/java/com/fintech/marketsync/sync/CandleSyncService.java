package com.fintech.marketsync.sync;

import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.Candle;
import com.fintech.marketsync.domain.IndicatorCandle;
import com.fintech.marketsync.domain.Timeframe;
import com.fintech.marketsync.indicator.AutoTrendResolver;
import com.fintech.marketsync.indicator.IndicatorEngine;
import com.fintech.marketsync.persistence.DurableCandleWriter;
import com.fintech.marketsync.series.CandleSeriesStore;
import com.fintech.marketsync.series.GapBackfillService;
import com.fintech.marketsync.ingestion.CandleFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Synchronization pipeline for one (symbol, timeframe):
 * fetch, merge into the raw series, ensure enough history, compute indicators,
 * resolve the cross-timeframe trend, save the indicator series, then mirror to the
 * durable store asynchronously.
 */
@Service
public class CandleSyncService {

    private static final Logger log = LoggerFactory.getLogger(CandleSyncService.class);

    private final CandleFetcher fetcher;
    private final CandleSeriesStore seriesStore;
    private final GapBackfillService gapBackfillService;
    private final IndicatorEngine indicatorEngine;
    private final AutoTrendResolver autoTrendResolver;
    private final DurableCandleWriter durableWriter;
    private final MarketDataProperties properties;

    public CandleSyncService(
            CandleFetcher fetcher,
            CandleSeriesStore seriesStore,
            GapBackfillService gapBackfillService,
            IndicatorEngine indicatorEngine,
            AutoTrendResolver autoTrendResolver,
            DurableCandleWriter durableWriter,
            MarketDataProperties properties) {
        this.fetcher = fetcher;
        this.seriesStore = seriesStore;
        this.gapBackfillService = gapBackfillService;
        this.indicatorEngine = indicatorEngine;
        this.autoTrendResolver = autoTrendResolver;
        this.durableWriter = durableWriter;
        this.properties = properties;
    }

    /**
     * Bar-end pass: fetch the newest closed candles, repair any gap before them,
     * merge and recompute.
     *
     * @return indicator candles written for the fetched range
     */
    public List<IndicatorCandle> syncCompleted(String symbol, int minutes) {
        String timeframe = Timeframe.toCode(minutes);
        List<Candle> completed = fetcher.fetchLatest(symbol, minutes, properties.getPolling().getCompletedCandles(), false);
        if (completed.isEmpty()) {
            log.warn("No completed candles fetched: symbol={}, timeframe={}", symbol, timeframe);
            return List.of();
        }
        Optional<Long> last = seriesStore.lastTimestamp(symbol, timeframe);
        if (last.isPresent()) {
            gapBackfillService.fillGap(symbol, minutes, last.get(), completed.get(completed.size() - 1).timestamp());
        }
        return updateSeries(symbol, minutes, completed, 0);
    }

    /**
     * Merges candles, tops the window up to the indicator minimum when short,
     * computes indicators and saves them. Closed entries already in the indicator
     * series are kept; the entries the cache holds at or after the first incoming
     * timestamp are mirrored, so both tiers carry the same values.
     */
    public List<IndicatorCandle> updateSeries(String symbol, int minutes, List<Candle> candles, int warmUpCount) {
        String timeframe = Timeframe.toCode(minutes);
        List<Candle> window = seriesStore.merge(symbol, timeframe, candles, warmUpCount);
        int minimum = indicatorEngine.minimumCandles();

        if (window.size() < minimum) {
            log.info("Window below indicator minimum, fetching more history: symbol={}, timeframe={}, have={}, need={}",
                symbol, timeframe, window.size(), minimum);
            List<Candle> history = fetcher.fetchHistory(symbol, minutes, minimum + warmUpCount, false);
            window = seriesStore.merge(symbol, timeframe, history, warmUpCount);
            if (window.size() < minimum) {
                log.warn("Not enough history for indicators, skipping computation: symbol={}, timeframe={}, have={}, need={}",
                    symbol, timeframe, window.size(), minimum);
                return List.of();
            }
        }

        List<IndicatorCandle> computed = withAutoTrend(symbol, minutes, indicatorEngine.compute(window));
        List<IndicatorCandle> output = stripWarmUp(computed, warmUpCount);
        List<IndicatorCandle> retained = seriesStore.saveIndicatorSeries(symbol, timeframe, output, false);

        long firstIncoming = candles.stream().mapToLong(Candle::timestamp).min().orElse(Long.MAX_VALUE);
        long lastComputed = output.isEmpty() ? Long.MIN_VALUE : output.get(output.size() - 1).timestamp();
        List<IndicatorCandle> changed = retained.stream()
            .filter(c -> c.timestamp() >= firstIncoming && c.timestamp() <= lastComputed)
            .toList();
        durableWriter.upsertAsync(symbol, minutes, changed);

        log.debug("Series updated: symbol={}, timeframe={}, window={}, output={}, mirrored={}",
            symbol, timeframe, window.size(), output.size(), changed.size());
        return changed;
    }

    /**
     * Refreshes the in-progress candle and its indicator values. The raw series is
     * not touched: the candle joins it once closed.
     */
    public Optional<IndicatorCandle> refreshCurrent(String symbol, int minutes) {
        String timeframe = Timeframe.toCode(minutes);
        List<Candle> latest = fetcher.fetchLatest(symbol, minutes, 2, true);
        Optional<Candle> current = latest.stream()
            .filter(Candle::current)
            .max(Comparator.comparingLong(Candle::timestamp));
        if (current.isEmpty()) {
            log.debug("No in-progress candle: symbol={}, timeframe={}", symbol, timeframe);
            return Optional.empty();
        }
        seriesStore.updateCurrent(symbol, timeframe, current.get());

        TreeMap<Long, Candle> window = new TreeMap<>();
        seriesStore.loadRaw(symbol, timeframe).forEach(c -> window.put(c.timestamp(), c));
        window.put(current.get().timestamp(), current.get());
        if (window.size() < indicatorEngine.minimumCandles()) {
            log.debug("Raw series too short for current indicators: symbol={}, timeframe={}, have={}",
                symbol, timeframe, window.size());
            return Optional.empty();
        }

        List<IndicatorCandle> computed = indicatorEngine.compute(new ArrayList<>(window.values()));
        IndicatorCandle last = computed.get(computed.size() - 1);
        IndicatorCandle withTrend = withAutoTrend(symbol, minutes, List.of(last)).get(0);

        seriesStore.saveIndicatorSeries(symbol, timeframe, List.of(withTrend), true);
        seriesStore.updateCurrentWithIndicators(symbol, timeframe, withTrend);
        durableWriter.upsertAsync(symbol, minutes, List.of(withTrend));
        return Optional.of(withTrend);
    }

    /**
     * Startup load: coarsest timeframe first so finer ones can read its trend, each
     * with warm-up history, then a second pass re-resolving the cross-timeframe trend.
     */
    public void initialLoad(String symbol) {
        int maxLen = seriesStore.getMaxLen();
        int warmUp = properties.getIndicators().getWarmUpCount();
        List<Integer> descending = properties.getTimeframes().stream()
            .sorted(Comparator.reverseOrder())
            .toList();

        for (int minutes : descending) {
            long started = System.currentTimeMillis();
            try {
                List<Candle> history = fetcher.fetchHistory(symbol, minutes, maxLen + warmUp, false);
                List<IndicatorCandle> written = updateSeries(symbol, minutes, history, warmUp);
                log.info("Initial load complete: symbol={}, timeframe={}, fetched={}, written={}, elapsedMs={}",
                    symbol, Timeframe.toCode(minutes), history.size(), written.size(),
                    System.currentTimeMillis() - started);
            } catch (RuntimeException e) {
                log.error("Initial load failed: symbol={}, timeframe={}, elapsedMs={}, error={}",
                    symbol, Timeframe.toCode(minutes), System.currentTimeMillis() - started, e.getMessage(), e);
            }
        }
        for (int minutes : descending) {
            try {
                recomputeAutoTrend(symbol, minutes);
            } catch (RuntimeException e) {
                log.error("Auto trend recompute failed: symbol={}, timeframe={}, error={}",
                    symbol, Timeframe.toCode(minutes), e.getMessage(), e);
            }
        }
    }

    /** Re-resolves the cross-timeframe trend over the whole stored indicator series. */
    public List<IndicatorCandle> recomputeAutoTrend(String symbol, int minutes) {
        String timeframe = Timeframe.toCode(minutes);
        List<IndicatorCandle> series = seriesStore.loadIndicatorSeries(symbol, timeframe);
        if (series.isEmpty()) {
            return List.of();
        }
        List<IndicatorCandle> updated = withAutoTrend(symbol, minutes, series);
        List<IndicatorCandle> saved = seriesStore.saveIndicatorSeries(symbol, timeframe, updated, true);
        durableWriter.upsertAsync(symbol, minutes, saved);
        return saved;
    }

    private List<IndicatorCandle> withAutoTrend(String symbol, int minutes, List<IndicatorCandle> candles) {
        List<IndicatorCandle> source = autoTrendResolver.sourceTimeframe(minutes)
            .map(src -> seriesStore.loadIndicatorSeries(symbol, Timeframe.toCode(src)))
            .orElse(List.of());
        return autoTrendResolver.apply(candles, source);
    }

    private static List<IndicatorCandle> stripWarmUp(List<IndicatorCandle> computed, int warmUpCount) {
        if (warmUpCount <= 0 || computed.size() <= warmUpCount) {
            return computed;
        }
        return computed.subList(warmUpCount, computed.size());
    }
}
