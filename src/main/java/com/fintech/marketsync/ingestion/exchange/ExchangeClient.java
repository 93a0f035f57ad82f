package com.fintech.marketsync.ingestion.exchange;

import java.util.List;

/**
 * Opaque OHLCV data source.
 */
public interface ExchangeClient {

    /**
     * Fetches up to {@code limit} candles, ascending by timestamp.
     *
     * @param symbol instrument id, e.g. "BTC-USDT-SWAP"
     * @param minutes timeframe width
     * @param limit maximum rows; providers cap this, see {@link #maxPageSize()} and
     *              {@link #maxHistoryPageSize()}
     * @param sinceMs when non-null, only candles at or after this epoch-milli timestamp;
     *                when null, the newest candles including the in-progress one
     * @throws RateLimitedException on a rate-limit response
     * @throws ExchangeNetworkException on transport failures
     * @throws MalformedResponseException when the response body cannot be read
     */
    List<ExchangeCandle> fetchCandles(String symbol, int minutes, int limit, Long sinceMs);

    /** Largest limit honoured in one call. */
    int maxPageSize();

    /**
     * Largest limit honoured by a time-anchored call ({@code sinceMs} non-null). Some
     * providers serve archived pages from a smaller endpoint than recent ones.
     */
    default int maxHistoryPageSize() {
        return maxPageSize();
    }
}
