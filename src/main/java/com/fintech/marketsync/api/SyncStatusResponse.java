package com.fintech.marketsync.api;

import com.fintech.marketsync.domain.Gap;
import com.fintech.marketsync.persistence.WriterStats;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operational snapshot of one worker.
 *
 * @param streamStatus last recorded stream state, "unknown" if never written
 * @param unresolvedGaps gaps keyed by "symbol:timeframe"; series without gaps are omitted
 */
public record SyncStatusResponse(
    boolean pollingRunning,
    boolean initialLoadDone,
    String streamStatus,
    WriterStats durableWriter,
    Set<String> activeLocks,
    Map<String, List<Gap>> unresolvedGaps,
    Map<String, String> initialLoadTask
) {
}
