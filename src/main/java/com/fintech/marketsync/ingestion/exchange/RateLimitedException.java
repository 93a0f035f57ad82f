package com.fintech.marketsync.ingestion.exchange;

/**
 * The exchange refused the request because the caller exceeded its rate limit.
 */
public class RateLimitedException extends ExchangeException {

    public RateLimitedException(String message) {
        super(message);
    }
}
