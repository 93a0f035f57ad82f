package com.fintech.marketsync.api;

import com.fintech.marketsync.cache.CacheKeys;
import com.fintech.marketsync.cache.CandleCache;
import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.coordination.DistributedLockService;
import com.fintech.marketsync.domain.Gap;
import com.fintech.marketsync.domain.IndicatorCandle;
import com.fintech.marketsync.domain.SeriesKey;
import com.fintech.marketsync.domain.Timeframe;
import com.fintech.marketsync.ingestion.PollingScheduler;
import com.fintech.marketsync.persistence.DurableCandleWriter;
import com.fintech.marketsync.series.CandleSeriesStore;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only view of the sync state for operators.
 */
@RestController
@RequestMapping("/api/v1/sync")
@Validated
public class SyncStatusController {

    private static final Logger log = LoggerFactory.getLogger(SyncStatusController.class);

    private final CandleSeriesStore seriesStore;
    private final DurableCandleWriter durableWriter;
    private final DistributedLockService lockService;
    private final CandleCache cache;
    private final ObjectProvider<PollingScheduler> pollingScheduler;
    private final MarketDataProperties properties;

    public SyncStatusController(
            CandleSeriesStore seriesStore,
            DurableCandleWriter durableWriter,
            DistributedLockService lockService,
            CandleCache cache,
            ObjectProvider<PollingScheduler> pollingScheduler,
            MarketDataProperties properties) {
        this.seriesStore = seriesStore;
        this.durableWriter = durableWriter;
        this.lockService = lockService;
        this.cache = cache;
        this.pollingScheduler = pollingScheduler;
        this.properties = properties;
    }

    @GetMapping("/status")
    public ResponseEntity<SyncStatusResponse> status() {
        Map<String, List<Gap>> gaps = new TreeMap<>();
        for (String symbol : properties.getSymbols()) {
            for (int minutes : properties.getTimeframes()) {
                SeriesKey key = SeriesKey.of(symbol, minutes);
                List<Gap> unresolved = seriesStore.unresolvedGaps(symbol, key.timeframe());
                if (!unresolved.isEmpty()) {
                    gaps.put(key.toString(), unresolved);
                }
            }
        }
        PollingScheduler scheduler = pollingScheduler.getIfAvailable();
        SyncStatusResponse response = new SyncStatusResponse(
            scheduler != null && scheduler.isRunning(),
            scheduler != null && scheduler.isInitialLoadDone(),
            cache.get(CacheKeys.STREAM_STATUS).orElse("unknown"),
            durableWriter.stats(),
            lockService.activeLocks(),
            gaps,
            cache.getHash(CacheKeys.taskStatus(PollingScheduler.TASK_INITIAL_LOAD)));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/v1/sync/series/{symbol}/{timeframe}
     *
     * Newest indicator candles of one series, oldest first.
     */
    @GetMapping("/series/{symbol}/{timeframe}")
    public ResponseEntity<List<IndicatorCandle>> series(
            @PathVariable String symbol,
            @PathVariable String timeframe,
            @RequestParam(defaultValue = "100") @Positive @Max(10_000) int limit) {
        if (!properties.getSymbols().contains(symbol)) {
            throw new IllegalArgumentException("Unknown symbol: " + symbol);
        }
        int minutes = Timeframe.toMinutes(timeframe);
        if (!properties.getTimeframes().contains(minutes)) {
            throw new IllegalArgumentException("Timeframe not synchronized: " + timeframe);
        }
        String code = Timeframe.toCode(minutes);
        List<IndicatorCandle> candles = seriesStore.loadIndicatorSeries(symbol, code);
        List<IndicatorCandle> tail = candles.subList(Math.max(0, candles.size() - limit), candles.size());
        log.debug("Series query: symbol={}, timeframe={}, limit={}, returned={}", symbol, code, limit, tail.size());
        return ResponseEntity.ok(tail);
    }
}
