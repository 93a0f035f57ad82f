package com.fintech.marketsync.persistence;

import com.fintech.marketsync.config.MarketDataProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.stereotype.Component;

/**
 * Builds a dedicated HikariCP pool per connect. Pool creation fails fast when the
 * database is unreachable.
 */
@Component
public class HikariDurableStoreConnector implements DurableStoreConnector {

    private static final String POOL_NAME = "durable-candle-writer";

    private final MarketDataProperties.DurableStore config;

    public HikariDurableStoreConnector(MarketDataProperties properties) {
        this.config = properties.getDurableStore();
    }

    @Override
    public DurableStore connect() {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName(POOL_NAME);
        hikari.setJdbcUrl(config.getUrl());
        hikari.setUsername(config.getUsername());
        hikari.setPassword(config.getPassword());
        hikari.setMinimumIdle(config.getMinPoolSize());
        hikari.setMaximumPoolSize(config.getMaxPoolSize());
        hikari.setConnectionTimeout(5_000L);
        hikari.setInitializationFailTimeout(1L);
        return new JdbcDurableStore(new HikariDataSource(hikari));
    }
}
