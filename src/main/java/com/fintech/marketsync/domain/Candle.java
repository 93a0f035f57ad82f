package com.fintech.marketsync.domain;

/**
 * Immutable OHLCV candle for one timeframe bucket.
 * Uses record semantics for immutability and compact constructor for validation.
 *
 * @param timestamp Bucket start in epoch seconds, aligned to the timeframe
 * @param open First price in bucket
 * @param high Maximum price (must be >= open, close, low)
 * @param low Minimum price (must be <= open, close, high)
 * @param close Last price in bucket
 * @param volume Traded volume in bucket
 * @param current True while the bucket has not closed yet
 */
public record Candle(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume,
    boolean current
) {

    /**
     * Validates OHLCV invariants. Rejected candles are skipped by ingestion.
     */
    public Candle {
        if (Double.isNaN(open) || Double.isNaN(high) || Double.isNaN(low)
                || Double.isNaN(close) || Double.isNaN(volume)) {
            throw new IllegalArgumentException("Candle fields cannot be NaN at timestamp=" + timestamp);
        }
        if (high < low) {
            throw new IllegalArgumentException(
                "High price (" + high + ") cannot be less than low price (" + low + ")"
            );
        }
        if (high < open || high < close) {
            throw new IllegalArgumentException(
                "High price (" + high + ") must be >= open (" + open + ") and close (" + close + ")"
            );
        }
        if (low > open || low > close) {
            throw new IllegalArgumentException(
                "Low price (" + low + ") must be <= open (" + open + ") and close (" + close + ")"
            );
        }
        if (volume < 0) {
            throw new IllegalArgumentException("Volume cannot be negative: " + volume);
        }
    }

    /** Closed candle. */
    public static Candle of(long timestamp, double open, double high, double low, double close, double volume) {
        return new Candle(timestamp, open, high, low, close, volume, false);
    }

    public Candle asCompleted() {
        return current ? new Candle(timestamp, open, high, low, close, volume, false) : this;
    }

    /** True if the timestamp sits on the timeframe boundary. */
    public boolean isAlignedTo(int minutes) {
        return timestamp % (minutes * 60L) == 0;
    }
}
