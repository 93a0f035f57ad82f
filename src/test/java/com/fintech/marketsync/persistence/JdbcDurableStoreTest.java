package com.fintech.marketsync.persistence;

import com.fintech.marketsync.domain.Candle;
import com.fintech.marketsync.domain.IndicatorCandle;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the JDBC durable store against a real PostgreSQL.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("JDBC Durable Store Tests")
class JdbcDurableStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("candles")
            .withUsername("test")
            .withPassword("test");

    private static final long T0 = 1_733_000_000L;

    private HikariDataSource dataSource;
    private JdbcDurableStore store;
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(postgres.getJdbcUrl());
        config.setUsername(postgres.getUsername());
        config.setPassword(postgres.getPassword());
        config.setMaximumPoolSize(2);
        dataSource = new HikariDataSource(config);
        store = new JdbcDurableStore(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("DROP TABLE IF EXISTS btcusdtswap");
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static CandleRow row(long ts, double close, Double ema7) {
        IndicatorCandle candle = IndicatorCandle.fromCandle(Candle.of(ts, close, close + 1, close - 1, close, 12.5));
        CandleRow base = CandleRow.from(candle, "1m");
        return new CandleRow(base.time(), base.timeframe(), base.open(), base.high(), base.low(), base.close(),
            base.volume(), null, null, ema7, null, 1, -1);
    }

    @Test
    @DisplayName("Should create the table on first write and store rows")
    void testUpsertCreatesTable() {
        int written = store.upsert("btcusdtswap", List.of(row(T0, 100.0, 99.5), row(T0 + 60, 101.0, null)));

        assertThat(written).isEqualTo(2);
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT close, ema7, trend_state, auto_trend_state FROM btcusdtswap ORDER BY time");
        assertThat(rows).hasSize(2);
        assertThat((BigDecimal) rows.get(0).get("close")).isEqualByComparingTo("100.0");
        assertThat(rows.get(0).get("ema7")).isEqualTo(99.5);
        assertThat(rows.get(1).get("ema7")).isNull();
        assertThat(rows.get(0).get("trend_state")).isEqualTo(1);
        assertThat(rows.get(0).get("auto_trend_state")).isEqualTo(-1);
    }

    @Test
    @DisplayName("Should update an existing (time, timeframe) row instead of duplicating it")
    void testUpsertIsIdempotent() {
        store.upsert("btcusdtswap", List.of(row(T0, 100.0, null)));
        store.upsert("btcusdtswap", List.of(row(T0, 105.0, 102.0)));

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM btcusdtswap", Integer.class);
        BigDecimal close = jdbcTemplate.queryForObject("SELECT close FROM btcusdtswap", BigDecimal.class);
        assertThat(count).isEqualTo(1);
        assertThat(close).isEqualByComparingTo("105.0");
    }

    @Test
    @DisplayName("Same timestamp on different timeframes are distinct rows")
    void testTimeframeIsPartOfKey() {
        CandleRow oneMinute = row(T0, 100.0, null);
        CandleRow fiveMinute = new CandleRow(oneMinute.time(), "5m", oneMinute.open(), oneMinute.high(),
            oneMinute.low(), oneMinute.close(), oneMinute.volume(), null, null, null, null, null, null);

        store.upsert("btcusdtswap", List.of(oneMinute, fiveMinute));

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM btcusdtswap", Integer.class);
        assertThat(count).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject table names that are not plain identifiers")
    void testRejectsInvalidTableName() {
        assertThatThrownBy(() -> store.upsert("btc; drop table x", List.of(row(T0, 100.0, null))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Ping succeeds on a live pool")
    void testPing() {
        store.ping();
        assertThat(dataSource.isRunning()).isTrue();
    }
}
