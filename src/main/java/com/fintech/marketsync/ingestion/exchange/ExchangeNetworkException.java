package com.fintech.marketsync.ingestion.exchange;

/**
 * Transport-level failure talking to the exchange: timeout, refused connection, 5xx.
 */
public class ExchangeNetworkException extends ExchangeException {

    public ExchangeNetworkException(String message) {
        super(message);
    }

    public ExchangeNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
