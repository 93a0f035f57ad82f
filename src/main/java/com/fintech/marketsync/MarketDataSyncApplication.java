package com.fintech.marketsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Market Data Sync
 *
 * Keeps multi-timeframe candle series for perpetual swaps in sync with the
 * exchange and enriches them with technical indicators.
 *
 * Key Features:
 * - Bar-end polling with gap backfill, plus a streaming feed for the latest candle
 * - Redis-backed bounded series with indicator snapshots
 * - Cross-timeframe trend resolution
 * - Best-effort mirroring into a PostgreSQL/TimescaleDB store
 * - Redis locks so several workers can run side by side
 *
 * The durable store owns its own connection pool, so Spring's DataSource
 * auto-configuration is off.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableScheduling
public class MarketDataSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketDataSyncApplication.class, args);
    }
}
