package com.fintech.marketsync.ingestion.exchange;

/**
 * Base class for failures reported by the exchange data source.
 */
public abstract class ExchangeException extends RuntimeException {

    protected ExchangeException(String message) {
        super(message);
    }

    protected ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
