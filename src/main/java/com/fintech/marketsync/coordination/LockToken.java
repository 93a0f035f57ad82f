package com.fintech.marketsync.coordination;

/**
 * Proof of lock ownership. Only the holder of the matching owner value may release.
 */
public record LockToken(String key, String owner) {
}
