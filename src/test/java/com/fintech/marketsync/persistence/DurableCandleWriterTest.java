package com.fintech.marketsync.persistence;

import com.fintech.marketsync.config.ApplicationConfig;
import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.IndicatorCandle;
import com.fintech.marketsync.support.MutableClock;
import com.fintech.marketsync.support.TestCandles;
import com.fintech.marketsync.support.TestProperties;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;

import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Durable Candle Writer Tests")
class DurableCandleWriterTest {

    private static final String SYMBOL = "BTC-USDT-SWAP";
    private static final long T0 = 1_704_067_200L;

    private MarketDataProperties properties;
    private RetryRegistry retryRegistry;
    private MutableClock clock;
    private FakeStore store;
    private AtomicInteger connects;
    private boolean connectorDown;
    private DurableCandleWriter writer;

    @BeforeEach
    void setUp() {
        properties = TestProperties.fast();
        retryRegistry = new ApplicationConfig().retryRegistry(properties);
        clock = MutableClock.atEpochSecond(T0);
        store = new FakeStore();
        connects = new AtomicInteger();
        connectorDown = false;
    }

    @AfterEach
    void tearDown() {
        if (writer != null) {
            writer.shutdown();
        }
    }

    private DurableCandleWriter startWriter() {
        DurableStoreConnector connector = () -> {
            connects.incrementAndGet();
            if (connectorDown) {
                throw new TransientDataAccessResourceException("connection refused");
            }
            return store;
        };
        writer = new DurableCandleWriter(connector, retryRegistry, clock, new SimpleMeterRegistry(), properties);
        writer.start();
        return writer;
    }

    private static List<IndicatorCandle> candles(int count) {
        List<IndicatorCandle> result = new ArrayList<>();
        TestCandles.series(T0, 1, count).forEach(c -> result.add(IndicatorCandle.fromCandle(c)));
        return result;
    }

    private static RuntimeException connectionLost() {
        return new TransientDataAccessResourceException("connection reset",
            new SQLTransientConnectionException("connection reset", "08006"));
    }

    @Test
    @DisplayName("Three connection failures then success: three retries with doubling waits")
    void testRetryThenSuccess() {
        startWriter();
        List<Duration> waits = new CopyOnWriteArrayList<>();
        retryRegistry.retry(DurableCandleWriter.RETRY_NAME, DurableCandleWriter.RETRY_NAME)
            .getEventPublisher().onRetry(event -> waits.add(event.getWaitInterval()));
        store.failNext(3, DurableCandleWriterTest::connectionLost);

        boolean written = writer.upsert(SYMBOL, 1, candles(4));

        assertThat(written).isTrue();
        WriterStats stats = writer.stats();
        assertThat(stats.retriedAttempts()).isEqualTo(3);
        assertThat(stats.successCount()).isEqualTo(4);
        assertThat(stats.failureCount()).isZero();
        assertThat(store.upsertCalls.get()).isEqualTo(4);
        assertThat(waits).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40));
    }

    @Test
    @DisplayName("Connection failures beyond the retry budget disable the writer")
    void testExhaustedRetriesDisable() {
        startWriter();
        store.failNext(4, DurableCandleWriterTest::connectionLost);

        boolean written = writer.upsert(SYMBOL, 1, candles(2));

        assertThat(written).isFalse();
        assertThat(writer.isEnabled()).isFalse();
        assertThat(writer.stats().failureCount()).isEqualTo(2);
        assertThat(writer.stats().lastFailureTime()).isNotNull();

        int callsBefore = store.upsertCalls.get();
        assertThat(writer.upsert(SYMBOL, 1, candles(2))).isFalse();
        assertThat(store.upsertCalls.get()).isEqualTo(callsBefore);
    }

    @Test
    @DisplayName("Data errors fail on the first attempt and keep the writer enabled")
    void testDataErrorNotRetried() {
        startWriter();
        store.failNext(1, () -> new DataIntegrityViolationException("numeric field overflow"));

        boolean written = writer.upsert(SYMBOL, 1, candles(1));

        assertThat(written).isFalse();
        assertThat(store.upsertCalls.get()).isEqualTo(1);
        assertThat(writer.stats().retriedAttempts()).isZero();
        assertThat(writer.isEnabled()).isTrue();
    }

    @Test
    @DisplayName("Failed initialization leaves the writer disabled until a health check reconnects")
    void testHealthCheckReconnect() {
        connectorDown = true;
        startWriter();
        assertThat(writer.isEnabled()).isFalse();
        assertThat(writer.upsert(SYMBOL, 1, candles(1))).isFalse();

        connectorDown = false;
        assertThat(writer.healthCheck()).isTrue();
        assertThat(writer.isEnabled()).isTrue();
        assertThat(writer.upsert(SYMBOL, 1, candles(1))).isTrue();
    }

    @Test
    @DisplayName("Health checks are throttled to the configured interval")
    void testHealthCheckThrottled() {
        startWriter();
        writer.healthCheck();
        store.pingFails = true;

        assertThat(writer.healthCheck()).isTrue();

        clock.advance(Duration.ofMillis(properties.getDurableStore().getHealthCheckIntervalMs()));
        connectorDown = true;
        assertThat(writer.healthCheck()).isFalse();
        assertThat(writer.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("A writer disabled by configuration never connects")
    void testDisabledByConfiguration() {
        properties.getDurableStore().setEnabled(false);
        startWriter();

        assertThat(writer.upsert(SYMBOL, 1, candles(1))).isFalse();
        assertThat(writer.healthCheck()).isFalse();
        assertThat(connects.get()).isZero();
    }

    @Test
    @DisplayName("Async upserts run off the caller thread")
    void testUpsertAsync() throws Exception {
        startWriter();

        Boolean written = writer.upsertAsync(SYMBOL, 5, candles(3)).get(5, TimeUnit.SECONDS);

        assertThat(written).isTrue();
        assertThat(store.tables).containsOnly("btc_usdt");
        assertThat(store.rows).extracting(CandleRow::timeframe).containsOnly("5m");
    }

    static class FakeStore implements DurableStore {

        final AtomicInteger upsertCalls = new AtomicInteger();
        final List<String> tables = new CopyOnWriteArrayList<>();
        final List<CandleRow> rows = new CopyOnWriteArrayList<>();
        volatile boolean pingFails;
        private int failuresRemaining;
        private Supplier<RuntimeException> failure;

        void failNext(int count, Supplier<RuntimeException> failure) {
            this.failuresRemaining = count;
            this.failure = failure;
        }

        @Override
        public void ping() {
            if (pingFails) {
                throw new TransientDataAccessResourceException("ping failed");
            }
        }

        @Override
        public synchronized int upsert(String table, List<CandleRow> batch) {
            upsertCalls.incrementAndGet();
            if (failuresRemaining > 0) {
                failuresRemaining--;
                throw failure.get();
            }
            tables.add(table);
            rows.addAll(batch);
            return batch.size();
        }

        @Override
        public void close() {
        }
    }
}
