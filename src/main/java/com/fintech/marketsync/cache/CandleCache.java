package com.fintech.marketsync.cache;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Key-value cache shared by both ingestion paths and all downstream readers.
 * Every write is last-write-wins per key; nothing here is transactional across keys.
 */
public interface CandleCache {

    /** Returns the whole list stored at key, or an empty list. */
    List<String> range(String key);

    /** Replaces the list stored at key with values, in order. */
    void replaceList(String key, List<String> values);

    Optional<String> get(String key);

    void set(String key, String value);

    /** Writes several string keys in one round trip. */
    void setAll(Map<String, String> values);

    void delete(String key);

    /**
     * Sets key only if absent, with expiry.
     *
     * @return true if this call created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Deletes key only if its current value equals expected.
     *
     * @return true if the key was deleted
     */
    boolean deleteIfEquals(String key, String expected);

    /** Keys matching a glob pattern. */
    Set<String> scan(String pattern);

    void putHash(String key, Map<String, String> fields);

    Map<String, String> getHash(String key);

    boolean ping();
}
