package com.fintech.marketsync.persistence;

import java.time.Instant;

/**
 * Snapshot of durable writer counters.
 *
 * @param successCount rows written
 * @param failureCount candles whose write failed after retries
 * @param retriedAttempts attempts that failed and were retried
 */
public record WriterStats(
    boolean enabled,
    long successCount,
    long failureCount,
    long totalCount,
    double successRate,
    long retriedAttempts,
    Instant lastFailureTime,
    Instant lastHealthCheck
) {
}
