package com.fintech.marketsync.ingestion;

import com.fintech.marketsync.cache.CacheKeys;
import com.fintech.marketsync.cache.CandleCache;
import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.coordination.DistributedLockService;
import com.fintech.marketsync.domain.SeriesKey;
import com.fintech.marketsync.domain.Timeframe;
import com.fintech.marketsync.persistence.DurableCandleWriter;
import com.fintech.marketsync.sync.CandleSyncService;
import com.fintech.marketsync.sync.TaskStatusRecorder;
import com.fintech.marketsync.sync.TaskStatusRecorder.Status;
import com.fintech.marketsync.util.TimeWindowManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Polling loop over the symbol x timeframe matrix.
 *
 * Each tick, per series: inside the bar-end window run the completed-candle sync (at
 * most once per spacing interval), otherwise refresh the in-progress candle at the
 * timeframe's refresh interval. Every unit runs under a distributed lock and fails
 * in isolation. The completed-candle lock is keyed by the bucket boundary and kept
 * until it expires, so one boundary is synced by one worker. The shutdown flag is
 * checked once per tick.
 */
@Component
@ConditionalOnProperty(prefix = "market-data.polling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PollingScheduler {

    private static final Logger log = LoggerFactory.getLogger(PollingScheduler.class);

    static final String TASK_COMPLETED = "completed";
    static final String TASK_CURRENT = "current";
    public static final String TASK_INITIAL_LOAD = "fetch_all_candles";

    private final CandleSyncService syncService;
    private final DistributedLockService lockService;
    private final TaskStatusRecorder statusRecorder;
    private final DurableCandleWriter durableWriter;
    private final CandleCache cache;
    private final TimeWindowManager timeWindowManager;
    private final MarketDataProperties properties;
    private final Clock clock;

    private final Map<SeriesKey, Long> lastCompletedRun = new ConcurrentHashMap<>();
    private final Map<SeriesKey, Long> lastCurrentRun = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean initialLoadDone = new AtomicBoolean(false);

    public PollingScheduler(
            CandleSyncService syncService,
            DistributedLockService lockService,
            TaskStatusRecorder statusRecorder,
            DurableCandleWriter durableWriter,
            CandleCache cache,
            TimeWindowManager timeWindowManager,
            MarketDataProperties properties,
            Clock clock) {
        this.syncService = syncService;
        this.lockService = lockService;
        this.statusRecorder = statusRecorder;
        this.durableWriter = durableWriter;
        this.cache = cache;
        this.timeWindowManager = timeWindowManager;
        this.properties = properties;
        this.clock = clock;
        if (!properties.getPolling().isInitialLoadEnabled()) {
            initialLoadDone.set(true);
        }
    }

    @Scheduled(fixedDelayString = "${market-data.polling.tick-ms:1000}")
    public void tick() {
        if (!running.get()) {
            return;
        }
        if (!initialLoadDone.get()) {
            runInitialLoad();
            return;
        }
        long now = clock.millis();
        for (String symbol : properties.getSymbols()) {
            for (int minutes : properties.getTimeframes()) {
                pollSeries(symbol, minutes, now);
            }
        }
    }

    void pollSeries(String symbol, int minutes, long now) {
        SeriesKey key = SeriesKey.of(symbol, minutes);
        if (timeWindowManager.isBarEnd(now, minutes)) {
            Long last = lastCompletedRun.get(key);
            if (last == null || now - last >= properties.getPolling().getCompletedMinSpacingMs()) {
                lastCompletedRun.put(key, now);
                long boundaryTs = Timeframe.align(now, minutes);
                runCompletedUnit(key, boundaryTs, () -> syncService.syncCompleted(symbol, minutes));
            }
            return;
        }
        long refreshMs = timeWindowManager.currentRefreshIntervalSeconds(minutes) * 1000L;
        Long last = lastCurrentRun.get(key);
        if (last == null || now - last >= refreshMs) {
            lastCurrentRun.put(key, now);
            runUnit(TASK_CURRENT, key, () -> syncService.refreshCurrent(symbol, minutes));
        }
    }

    /** One lock-gated, failure-isolated unit of work. */
    void runUnit(String taskKind, SeriesKey key, Runnable work) {
        String lockKey = CacheKeys.lock(taskKind, key.symbol(), key.timeframe());
        runGuarded(taskKind, key, () -> lockService.runExclusive(lockKey, work));
    }

    /** Completed-candle sync for one boundary. Runs once across workers unless it fails. */
    void runCompletedUnit(SeriesKey key, long boundaryTs, Runnable work) {
        String lockKey = CacheKeys.lock(TASK_COMPLETED, key.symbol(), key.timeframe(), boundaryTs);
        runGuarded(TASK_COMPLETED, key, () -> lockService.runOnce(lockKey, work));
    }

    private void runGuarded(String taskKind, SeriesKey key, BooleanSupplier lockedWork) {
        long started = clock.millis();
        try {
            boolean ran = lockedWork.getAsBoolean();
            if (!ran) {
                log.debug("Skipped, lock held by another worker: task={}, symbol={}, timeframe={}",
                    taskKind, key.symbol(), key.timeframe());
                return;
            }
            statusRecorder.record(taskKind, key.symbol(), key.timeframe(), Status.SUCCESS,
                clock.millis() - started, null);
        } catch (RuntimeException e) {
            long elapsed = clock.millis() - started;
            log.error("Sync unit failed: task={}, symbol={}, timeframe={}, elapsedMs={}, error={}",
                taskKind, key.symbol(), key.timeframe(), elapsed, e.getMessage(), e);
            statusRecorder.record(taskKind, key.symbol(), key.timeframe(), Status.FAILED, elapsed, e.getMessage());
        }
    }

    void runInitialLoad() {
        long started = clock.millis();
        String statusKey = CacheKeys.taskStatus(TASK_INITIAL_LOAD);
        try {
            boolean ran = lockService.runExclusive(
                CacheKeys.lock(TASK_INITIAL_LOAD),
                Duration.ofMillis(properties.getLock().getInitialLoadTtlMs()),
                () -> {
                    statusRecorder.record(statusKey, Status.RUNNING, 0, null);
                    for (String symbol : properties.getSymbols()) {
                        if (!running.get()) {
                            return;
                        }
                        syncService.initialLoad(symbol);
                    }
                });
            if (ran) {
                statusRecorder.record(statusKey, Status.SUCCESS, clock.millis() - started, null);
                log.info("Initial load finished: symbols={}, timeframes={}, elapsedMs={}",
                    properties.getSymbols().size(), properties.getTimeframes().size(), clock.millis() - started);
            } else {
                log.info("Initial load running in another worker, continuing with polling");
            }
        } catch (RuntimeException e) {
            statusRecorder.record(statusKey, Status.FAILED, clock.millis() - started, e.getMessage());
            log.error("Initial load failed, continuing with polling: {}", e.getMessage(), e);
        } finally {
            initialLoadDone.set(true);
        }
    }

    @Scheduled(fixedDelayString = "${market-data.polling.health-check-interval-ms:300000}",
               initialDelayString = "${market-data.polling.health-check-interval-ms:300000}")
    public void healthCheck() {
        if (!running.get()) {
            return;
        }
        boolean writerOk = durableWriter.healthCheck();
        boolean cacheOk = cache.ping();
        if (!writerOk || !cacheOk) {
            log.warn("Health check: durableStore={}, cache={}", writerOk ? "up" : "down", cacheOk ? "up" : "down");
        } else {
            log.debug("Health check: all dependencies up");
        }
    }

    @Scheduled(fixedDelayString = "${market-data.polling.stats-log-interval-ms:600000}",
               initialDelayString = "${market-data.polling.stats-log-interval-ms:600000}")
    public void logStats() {
        durableWriter.logStats();
    }

    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Polling scheduler stopping after current tick");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isInitialLoadDone() {
        return initialLoadDone.get();
    }
}
