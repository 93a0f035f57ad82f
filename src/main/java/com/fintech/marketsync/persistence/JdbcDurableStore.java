package com.fintech.marketsync.persistence;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * PostgreSQL/TimescaleDB store over a HikariCP pool and {@link JdbcTemplate}.
 *
 * One table per symbol, primary key (time, timeframe). Tables are created on first write.
 */
public class JdbcDurableStore implements DurableStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcDurableStore.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[a-z][a-z0-9_]{0,62}");

    private static final String CREATE_TABLE =
        "CREATE TABLE IF NOT EXISTS %s (" +
        " time TIMESTAMPTZ NOT NULL," +
        " timeframe VARCHAR(8) NOT NULL," +
        " open NUMERIC(30, 10) NOT NULL," +
        " high NUMERIC(30, 10) NOT NULL," +
        " low NUMERIC(30, 10) NOT NULL," +
        " close NUMERIC(30, 10) NOT NULL," +
        " volume NUMERIC(30, 10) NOT NULL," +
        " rsi14 DOUBLE PRECISION," +
        " atr DOUBLE PRECISION," +
        " ema7 DOUBLE PRECISION," +
        " ma20 DOUBLE PRECISION," +
        " trend_state INTEGER," +
        " auto_trend_state INTEGER," +
        " PRIMARY KEY (time, timeframe))";

    private static final String UPSERT =
        "INSERT INTO %s (time, timeframe, open, high, low, close, volume," +
        " rsi14, atr, ema7, ma20, trend_state, auto_trend_state)" +
        " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)" +
        " ON CONFLICT (time, timeframe) DO UPDATE SET" +
        " open = EXCLUDED.open, high = EXCLUDED.high, low = EXCLUDED.low," +
        " close = EXCLUDED.close, volume = EXCLUDED.volume," +
        " rsi14 = EXCLUDED.rsi14, atr = EXCLUDED.atr, ema7 = EXCLUDED.ema7," +
        " ma20 = EXCLUDED.ma20, trend_state = EXCLUDED.trend_state," +
        " auto_trend_state = EXCLUDED.auto_trend_state";

    private final HikariDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final Set<String> knownTables = ConcurrentHashMap.newKeySet();

    public JdbcDurableStore(HikariDataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @Override
    public void ping() {
        jdbcTemplate.queryForObject("SELECT 1", Integer.class);
    }

    @Override
    public int upsert(String table, List<CandleRow> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        ensureTable(table);

        int[] counts = jdbcTemplate.batchUpdate(String.format(UPSERT, table), new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                CandleRow row = rows.get(i);
                ps.setTimestamp(1, Timestamp.from(row.time()));
                ps.setString(2, row.timeframe());
                ps.setBigDecimal(3, row.open());
                ps.setBigDecimal(4, row.high());
                ps.setBigDecimal(5, row.low());
                ps.setBigDecimal(6, row.close());
                ps.setBigDecimal(7, row.volume());
                setNullableDouble(ps, 8, row.rsi14());
                setNullableDouble(ps, 9, row.atr());
                setNullableDouble(ps, 10, row.ema7());
                setNullableDouble(ps, 11, row.ma20());
                setNullableInt(ps, 12, row.trendState());
                setNullableInt(ps, 13, row.autoTrendState());
            }

            @Override
            public int getBatchSize() {
                return rows.size();
            }
        });
        return counts.length;
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("Durable store pool closed: pool={}", dataSource.getPoolName());
        }
    }

    private void ensureTable(String table) {
        if (knownTables.contains(table)) {
            return;
        }
        jdbcTemplate.execute(String.format(CREATE_TABLE, table));
        knownTables.add(table);
        log.info("Durable store table ready: table={}", table);
    }

    private static void setNullableDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.DOUBLE);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }
}
