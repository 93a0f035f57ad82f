package com.fintech.marketsync.persistence;

import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.IndicatorCandle;
import com.fintech.marketsync.domain.Symbols;
import com.fintech.marketsync.domain.Timeframe;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mirrors indicator candles into the durable time-series store.
 *
 * State machine:
 * <ul>
 *   <li>disabled -> enabled: pool initialization succeeds</li>
 *   <li>enabled -> disabled: a connection-class failure survives all retries, or a health check fails</li>
 *   <li>disabled -> enabled: a health-check reconnect succeeds</li>
 * </ul>
 * Writes no-op while disabled. Only connection-class errors are retried; data errors
 * fail on the first attempt. The cache is the source of truth; failures here are
 * counted and logged, never propagated to the cache path.
 */
@Component
public class DurableCandleWriter {

    private static final Logger log = LoggerFactory.getLogger(DurableCandleWriter.class);

    public static final String RETRY_NAME = "durableStore";

    private final DurableStoreConnector connector;
    private final Retry retry;
    private final Clock clock;
    private final boolean configuredEnabled;
    private final Duration healthCheckInterval;

    private final AtomicLong successCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);
    private final AtomicLong retriedAttempts = new AtomicLong(0);
    private final Timer writeTimer;

    private final ExecutorService asyncExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "durable-writer");
        thread.setDaemon(true);
        return thread;
    });

    private volatile DurableStore store;
    private volatile boolean enabled;
    private volatile Instant lastFailureTime;
    private volatile Instant lastHealthCheck;

    public DurableCandleWriter(
            DurableStoreConnector connector,
            RetryRegistry retryRegistry,
            Clock clock,
            MeterRegistry meterRegistry,
            MarketDataProperties properties) {
        this.connector = connector;
        this.retry = retryRegistry.retry(RETRY_NAME, RETRY_NAME);
        this.clock = clock;
        this.configuredEnabled = properties.getDurableStore().isEnabled();
        this.healthCheckInterval = Duration.ofMillis(properties.getDurableStore().getHealthCheckIntervalMs());

        meterRegistry.gauge("durable.writer.rows.success", successCount);
        meterRegistry.gauge("durable.writer.rows.failure", failureCount);
        meterRegistry.gauge("durable.writer.attempts.retried", retriedAttempts);
        this.writeTimer = meterRegistry.timer("durable.writer.upsert.latency");

        retry.getEventPublisher()
            .onRetry(event -> {
                retriedAttempts.incrementAndGet();
                log.warn("Durable store operation failed, retrying: attempt={}, wait={}ms, cause={}",
                    event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a");
            });
    }

    @PostConstruct
    public void start() {
        if (!configuredEnabled) {
            log.info("Durable writer disabled by configuration");
            return;
        }
        initialize();
    }

    /**
     * Opens a new pool and verifies it with a round trip.
     *
     * @return true if the writer is enabled afterwards
     */
    public synchronized boolean initialize() {
        try {
            DurableStore opened = connector.connect();
            try {
                opened.ping();
            } catch (RuntimeException e) {
                opened.close();
                throw e;
            }
            store = opened;
            enabled = true;
            log.info("Durable writer enabled");
            return true;
        } catch (RuntimeException e) {
            enabled = false;
            store = null;
            log.error("Durable writer initialization failed, writes disabled: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Throttled health check. When enabled, runs a round trip; on failure flips to
     * disabled and falls through to a reconnect. When disabled, re-initializes the pool.
     *
     * @return enabled state after the check
     */
    public synchronized boolean healthCheck() {
        if (!configuredEnabled) {
            return false;
        }
        Instant now = clock.instant();
        if (lastHealthCheck != null && now.isBefore(lastHealthCheck.plus(healthCheckInterval))) {
            return enabled;
        }
        lastHealthCheck = now;

        if (enabled && store != null) {
            try {
                store.ping();
                return true;
            } catch (RuntimeException e) {
                log.warn("Durable store health check failed, reconnecting: {}", e.getMessage());
                enabled = false;
            }
        }
        return reconnect();
    }

    private boolean reconnect() {
        closeStore();
        boolean ok = initialize();
        if (ok) {
            log.info("Durable store reconnection successful");
        } else {
            log.warn("Durable store reconnection failed");
        }
        return ok;
    }

    /**
     * Upserts candles into the symbol's table. No-op when disabled or empty.
     *
     * @return true if the batch was written
     */
    public boolean upsert(String symbol, int minutes, List<IndicatorCandle> candles) {
        DurableStore current = store;
        if (!enabled || current == null || candles == null || candles.isEmpty()) {
            return false;
        }
        String table = Symbols.normalize(symbol);
        String timeframe = Timeframe.toCode(minutes);

        List<CandleRow> rows = new ArrayList<>(candles.size());
        for (IndicatorCandle candle : candles) {
            try {
                rows.add(CandleRow.from(candle, timeframe));
            } catch (RuntimeException e) {
                log.warn("Skipping unconvertible candle: table={}, timeframe={}, ts={}, error={}",
                    table, timeframe, candle.timestamp(), e.getMessage());
            }
        }
        if (rows.isEmpty()) {
            log.warn("No valid rows to write: table={}, timeframe={}", table, timeframe);
            return false;
        }

        long started = System.nanoTime();
        try {
            int written = retry.executeSupplier(() -> current.upsert(table, rows));
            successCount.addAndGet(written);
            log.info("Durable upsert: table={}, timeframe={}, rows={}, success={}, failures={}",
                table, timeframe, written, successCount.get(), failureCount.get());
            return true;
        } catch (RuntimeException e) {
            failureCount.addAndGet(candles.size());
            lastFailureTime = clock.instant();
            if (isConnectionError(e)) {
                enabled = false;
            }
            log.error("Durable upsert failed: table={}, timeframe={}, rows={}, elapsedMs={}, success={}, failures={}, error={}",
                table, timeframe, rows.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started),
                successCount.get(), failureCount.get(), e.getMessage());
            return false;
        } finally {
            writeTimer.record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
        }
    }

    public boolean upsertSingle(String symbol, int minutes, IndicatorCandle candle) {
        return upsert(symbol, minutes, List.of(candle));
    }

    /**
     * Queues an upsert on the writer thread so callers never wait on the durable store.
     */
    public CompletableFuture<Boolean> upsertAsync(String symbol, int minutes, List<IndicatorCandle> candles) {
        if (!enabled || candles.isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }
        List<IndicatorCandle> snapshot = List.copyOf(candles);
        return CompletableFuture.supplyAsync(() -> upsert(symbol, minutes, snapshot), asyncExecutor)
            .exceptionally(e -> {
                log.warn("Async durable upsert failed: symbol={}, minutes={}, error={}", symbol, minutes, e.getMessage());
                return false;
            });
    }

    public WriterStats stats() {
        long success = successCount.get();
        long failure = failureCount.get();
        long total = success + failure;
        double rate = total > 0 ? success * 100.0 / total : 0.0;
        return new WriterStats(enabled, success, failure, total, rate, retriedAttempts.get(),
            lastFailureTime, lastHealthCheck);
    }

    public void logStats() {
        WriterStats stats = stats();
        log.info("Durable writer stats: enabled={}, success={}, failure={}, total={}, successRate={}%, retried={}",
            stats.enabled(), stats.successCount(), stats.failureCount(), stats.totalCount(),
            String.format("%.2f", stats.successRate()), stats.retriedAttempts());
    }

    public boolean isEnabled() {
        return enabled;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down durable writer...");
        asyncExecutor.shutdown();
        try {
            if (!asyncExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Pending durable writes did not finish in time, dropping them");
                asyncExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            asyncExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        closeStore();
        enabled = false;
        log.info("Durable writer shutdown complete");
    }

    private synchronized void closeStore() {
        DurableStore old = store;
        store = null;
        if (old != null) {
            try {
                old.close();
            } catch (RuntimeException e) {
                log.warn("Error closing durable store: {}", e.getMessage());
            }
        }
    }

    /**
     * Connection-class failures: lost or refused connections, pool exhaustion,
     * SQLState class 08.
     */
    public static boolean isConnectionError(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof DataAccessResourceFailureException
                    || t instanceof TransientDataAccessResourceException
                    || t instanceof RecoverableDataAccessException
                    || t instanceof SQLTransientConnectionException
                    || t instanceof SQLNonTransientConnectionException) {
                return true;
            }
            if (t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("08")) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }
}
