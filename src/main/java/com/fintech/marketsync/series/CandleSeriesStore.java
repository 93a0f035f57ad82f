package com.fintech.marketsync.series;

import com.fintech.marketsync.cache.CacheKeys;
import com.fintech.marketsync.cache.CandleCache;
import com.fintech.marketsync.cache.CandleCodec;
import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.Candle;
import com.fintech.marketsync.domain.Gap;
import com.fintech.marketsync.domain.IndicatorCandle;
import com.fintech.marketsync.domain.Timeframe;
import com.fintech.marketsync.util.DisplayTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Canonical per (symbol, timeframe) candle series held in the cache.
 *
 * Two parallel representations are kept: the raw series (OHLCV only, compact rows)
 * and the indicator series (JSON rows). Both are ascending, deduplicated by timestamp
 * and capped at the retention length by dropping the oldest entries.
 */
@Component
public class CandleSeriesStore {

    private static final Logger log = LoggerFactory.getLogger(CandleSeriesStore.class);

    private final CandleCache cache;
    private final CandleCodec codec;
    private final DisplayTimeFormatter timeFormatter;
    private final Clock clock;
    private final int maxLen;

    public CandleSeriesStore(
            CandleCache cache,
            CandleCodec codec,
            DisplayTimeFormatter timeFormatter,
            Clock clock,
            MarketDataProperties properties) {
        this.cache = cache;
        this.codec = codec;
        this.timeFormatter = timeFormatter;
        this.clock = clock;
        this.maxLen = properties.getSeries().getMaxLen();
    }

    public int getMaxLen() {
        return maxLen;
    }

    /** Raw series, ascending. Rows that fail to decode are dropped. */
    public List<Candle> loadRaw(String symbol, String timeframe) {
        List<String> rows = cache.range(CacheKeys.rawSeries(symbol, timeframe));
        TreeMap<Long, Candle> byTimestamp = new TreeMap<>();
        int skipped = 0;
        for (String row : rows) {
            Optional<Candle> candle = codec.decodeRaw(row);
            if (candle.isPresent()) {
                byTimestamp.put(candle.get().timestamp(), candle.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped undecodable raw rows: symbol={}, timeframe={}, skipped={}", symbol, timeframe, skipped);
        }
        return new ArrayList<>(byTimestamp.values());
    }

    public Optional<Long> lastTimestamp(String symbol, String timeframe) {
        List<Candle> raw = loadRaw(symbol, timeframe);
        return raw.isEmpty() ? Optional.empty() : Optional.of(raw.get(raw.size() - 1).timestamp());
    }

    /**
     * Merges new candles into the raw series by timestamp, last write wins.
     *
     * <p>The returned window holds up to {@code maxLen + warmUpCount} candles so the
     * indicator engine sees enough leading history. The persisted raw series is
     * trimmed to {@code maxLen}. Candles not aligned to the timeframe are rejected.
     *
     * @return merged ascending window for indicator computation
     */
    public List<Candle> merge(String symbol, String timeframe, Collection<Candle> newCandles, int warmUpCount) {
        int minutes = Timeframe.toMinutes(timeframe);
        TreeMap<Long, Candle> byTimestamp = new TreeMap<>();
        for (Candle existing : loadRaw(symbol, timeframe)) {
            byTimestamp.put(existing.timestamp(), existing);
        }
        int rejected = 0;
        for (Candle candle : newCandles) {
            if (!candle.isAlignedTo(minutes)) {
                rejected++;
                continue;
            }
            byTimestamp.put(candle.timestamp(), candle.asCompleted());
        }
        if (rejected > 0) {
            log.warn("Rejected unaligned candles: symbol={}, timeframe={}, rejected={}", symbol, timeframe, rejected);
        }

        List<Candle> merged = new ArrayList<>(byTimestamp.values());
        List<Candle> window = tail(merged, maxLen + Math.max(0, warmUpCount));
        List<Candle> retained = tail(merged, maxLen);

        List<String> rows = new ArrayList<>(retained.size());
        retained.forEach(c -> rows.add(codec.encodeRaw(c)));
        cache.replaceList(CacheKeys.rawSeries(symbol, timeframe), rows);

        if (log.isDebugEnabled()) {
            log.debug("Merged raw series: symbol={}, timeframe={}, incoming={}, stored={}, window={}",
                symbol, timeframe, newCandles.size(), retained.size(), window.size());
        }
        return window;
    }

    /** Indicator series, ascending. */
    public List<IndicatorCandle> loadIndicatorSeries(String symbol, String timeframe) {
        List<String> rows = cache.range(CacheKeys.indicatorSeries(symbol, timeframe));
        TreeMap<Long, IndicatorCandle> byTimestamp = new TreeMap<>();
        for (String row : rows) {
            codec.decodeIndicator(row).ifPresent(c -> byTimestamp.put(c.timestamp(), c));
        }
        return new ArrayList<>(byTimestamp.values());
    }

    /**
     * Merges candles into the indicator series and trims to the retention length.
     *
     * <p>An existing closed entry is only replaced when {@code overwrite} is set; an
     * existing in-progress entry is always replaced so a bar's final values supersede
     * its intra-bar snapshot.
     */
    public List<IndicatorCandle> saveIndicatorSeries(
            String symbol, String timeframe, List<IndicatorCandle> candles, boolean overwrite) {
        TreeMap<Long, IndicatorCandle> byTimestamp = new TreeMap<>();
        for (IndicatorCandle existing : loadIndicatorSeries(symbol, timeframe)) {
            byTimestamp.put(existing.timestamp(), existing);
        }
        int added = 0;
        for (IndicatorCandle candle : candles) {
            IndicatorCandle existing = byTimestamp.get(candle.timestamp());
            if (existing == null || existing.current() || overwrite) {
                byTimestamp.put(candle.timestamp(), withHumanTimes(candle));
                added++;
            }
        }
        List<IndicatorCandle> retained = tail(new ArrayList<>(byTimestamp.values()), maxLen);
        List<String> rows = new ArrayList<>(retained.size());
        retained.forEach(c -> rows.add(codec.encodeIndicator(c)));
        cache.replaceList(CacheKeys.indicatorSeries(symbol, timeframe), rows);

        log.debug("Saved indicator series: symbol={}, timeframe={}, written={}, stored={}",
            symbol, timeframe, added, retained.size());
        return retained;
    }

    /** Overwrites the current-candle and latest slots. */
    public void updateCurrent(String symbol, String timeframe, Candle candle) {
        String json = codec.write(slotPayload(candle));
        Map<String, String> writes = new LinkedHashMap<>();
        writes.put(CacheKeys.currentCandle(symbol, timeframe), json);
        writes.put(CacheKeys.latest(symbol, timeframe), json);
        cache.setAll(writes);
    }

    /** Overwrites the latest slot of several timeframes in one write. Used by the streaming path. */
    public void updateLatest(String symbol, Map<String, Candle> candlesByTimeframe) {
        Map<String, String> writes = new LinkedHashMap<>();
        candlesByTimeframe.forEach((timeframe, candle) ->
            writes.put(CacheKeys.latest(symbol, timeframe), codec.write(slotPayload(candle))));
        cache.setAll(writes);
    }

    public void updateCurrentWithIndicators(String symbol, String timeframe, IndicatorCandle candle) {
        String json = codec.encodeIndicator(withHumanTimes(candle));
        Map<String, String> writes = new LinkedHashMap<>();
        writes.put(CacheKeys.currentWithIndicators(symbol, timeframe), json);
        writes.put(CacheKeys.latestWithIndicators(symbol, timeframe), json);
        cache.setAll(writes);
    }

    /** Records a hole the capped backfill could not close. */
    public void recordGap(String symbol, String timeframe, Gap gap) {
        String key = CacheKeys.gaps(symbol, timeframe);
        List<String> rows = new ArrayList<>(cache.range(key));
        String row = gap.startTs() + "," + gap.endTs();
        if (!rows.contains(row)) {
            rows.add(row);
            cache.replaceList(key, rows);
        }
    }

    public void clearGaps(String symbol, String timeframe) {
        cache.delete(CacheKeys.gaps(symbol, timeframe));
    }

    public List<Gap> unresolvedGaps(String symbol, String timeframe) {
        List<Gap> gaps = new ArrayList<>();
        for (String row : cache.range(CacheKeys.gaps(symbol, timeframe))) {
            String[] parts = row.split(",");
            if (parts.length == 2) {
                try {
                    gaps.add(new Gap(Long.parseLong(parts[0]), Long.parseLong(parts[1])));
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring malformed gap record: symbol={}, timeframe={}, row={}", symbol, timeframe, row);
                }
            }
        }
        return gaps;
    }

    private IndicatorCandle withHumanTimes(IndicatorCandle candle) {
        return candle.withHumanTimes(timeFormatter.utc(candle.timestamp()), timeFormatter.local(candle.timestamp()));
    }

    private Map<String, Object> slotPayload(Candle candle) {
        long now = clock.millis();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", candle.timestamp());
        payload.put("open", candle.open());
        payload.put("high", candle.high());
        payload.put("low", candle.low());
        payload.put("close", candle.close());
        payload.put("volume", candle.volume());
        payload.put("current", candle.current());
        payload.put("update_time", now / 1000L);
        payload.put("update_time_local", timeFormatter.localMillis(now));
        return payload;
    }

    private static <T> List<T> tail(List<T> list, int size) {
        if (list.size() <= size) {
            return list;
        }
        return new ArrayList<>(list.subList(list.size() - size, list.size()));
    }
}
