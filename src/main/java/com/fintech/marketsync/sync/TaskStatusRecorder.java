package com.fintech.marketsync.sync;

import com.fintech.marketsync.cache.CacheKeys;
import com.fintech.marketsync.cache.CandleCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the outcome of each synchronization unit to a cache hash so operators can
 * see what ran, when, and how it ended.
 */
@Component
public class TaskStatusRecorder {

    private static final Logger log = LoggerFactory.getLogger(TaskStatusRecorder.class);

    public enum Status { RUNNING, SUCCESS, FAILED }

    private final CandleCache cache;
    private final Clock clock;

    public TaskStatusRecorder(CandleCache cache, Clock clock) {
        this.cache = cache;
        this.clock = clock;
    }

    public void record(String statusKey, Status status, long elapsedMs, String error) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("timestamp", String.valueOf(clock.millis() / 1000L));
        fields.put("status", status.name().toLowerCase());
        fields.put("elapsed_ms", String.valueOf(elapsedMs));
        fields.put("error", error != null ? error : "");
        try {
            cache.putHash(statusKey, fields);
        } catch (RuntimeException e) {
            log.warn("Failed to record task status: key={}, status={}, error={}", statusKey, status, e.getMessage());
        }
    }

    public void record(String taskKind, String symbol, String timeframe, Status status, long elapsedMs, String error) {
        record(CacheKeys.taskStatus(taskKind, symbol, timeframe), status, elapsedMs, error);
    }
}
