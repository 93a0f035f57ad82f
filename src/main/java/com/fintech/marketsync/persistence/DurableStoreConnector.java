package com.fintech.marketsync.persistence;

/**
 * Opens a fresh {@link DurableStore}, including its connection pool.
 */
@FunctionalInterface
public interface DurableStoreConnector {

    DurableStore connect();
}
