package com.fintech.marketsync.ingestion.exchange;

/**
 * The exchange answered with a body that cannot be interpreted as candle data.
 */
public class MalformedResponseException extends ExchangeException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
