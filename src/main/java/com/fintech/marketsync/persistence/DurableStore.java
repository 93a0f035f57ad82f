package com.fintech.marketsync.persistence;

import java.util.List;

/**
 * Open handle to the durable time-series store. Owned exclusively by
 * {@link DurableCandleWriter}; callers never see raw connections.
 */
public interface DurableStore extends AutoCloseable {

    /** Trivial round trip. Throws on failure. */
    void ping();

    /**
     * Batched insert-or-update keyed by (time, timeframe) into the per-symbol table.
     *
     * @return rows written
     */
    int upsert(String table, List<CandleRow> rows);

    @Override
    void close();
}
