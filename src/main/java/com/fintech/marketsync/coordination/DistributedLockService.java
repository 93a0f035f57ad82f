package com.fintech.marketsync.coordination;

import com.fintech.marketsync.cache.CandleCache;
import com.fintech.marketsync.config.MarketDataProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * TTL-bounded mutual exclusion across worker processes, backed by the shared cache.
 *
 * Acquire is a set-if-absent with expiry; release deletes the key only while it still
 * holds the caller's owner token. Expiry is the only unconditional release.
 */
@Service
public class DistributedLockService {

    private static final Logger log = LoggerFactory.getLogger(DistributedLockService.class);

    private static final String LOCK_PATTERN = "lock:*";

    private final CandleCache cache;
    private final Duration defaultTtl;

    public DistributedLockService(CandleCache cache, MarketDataProperties properties) {
        this.cache = cache;
        this.defaultTtl = Duration.ofMillis(properties.getLock().getTtlMs());
    }

    /**
     * @return token if acquired, empty if another owner currently holds the key
     */
    public Optional<LockToken> acquire(String key, Duration ttl) {
        String owner = UUID.randomUUID().toString();
        if (cache.setIfAbsent(key, owner, ttl)) {
            log.debug("Lock acquired: key={}, ttlMs={}", key, ttl.toMillis());
            return Optional.of(new LockToken(key, owner));
        }
        return Optional.empty();
    }

    /**
     * Releases the lock if the stored owner still matches. A mismatch is a no-op:
     * the lock expired and was taken over by someone else.
     *
     * @return true if this call removed the key
     */
    public boolean release(LockToken token) {
        boolean released = cache.deleteIfEquals(token.key(), token.owner());
        if (!released) {
            log.warn("Lock release skipped, owner changed or lock expired: key={}", token.key());
        }
        return released;
    }

    /** Runs task under the lock with the default TTL. */
    public boolean runExclusive(String key, Runnable task) {
        return runExclusive(key, defaultTtl, task);
    }

    /**
     * Runs task only if the lock is free. Refusal is a normal skip, not an error.
     *
     * @return true if the task ran
     */
    public boolean runExclusive(String key, Duration ttl, Runnable task) {
        Optional<LockToken> token = acquire(key, ttl);
        if (token.isEmpty()) {
            log.debug("Lock held elsewhere, skipping: key={}", key);
            return false;
        }
        try {
            task.run();
            return true;
        } finally {
            release(token.get());
        }
    }

    /** Runs task at most once per key with the default TTL. */
    public boolean runOnce(String key, Runnable task) {
        return runOnce(key, defaultTtl, task);
    }

    /**
     * Runs task only if the lock is free and keeps the lock after success, so the key
     * stays claimed until it expires. A failure releases it and another worker may retry.
     *
     * @return true if the task ran
     */
    public boolean runOnce(String key, Duration ttl, Runnable task) {
        Optional<LockToken> token = acquire(key, ttl);
        if (token.isEmpty()) {
            log.debug("Unit already claimed, skipping: key={}", key);
            return false;
        }
        try {
            task.run();
            return true;
        } catch (RuntimeException e) {
            release(token.get());
            throw e;
        }
    }

    /** Currently held lock keys. Diagnostics only. */
    public Set<String> activeLocks() {
        return cache.scan(LOCK_PATTERN);
    }
}
