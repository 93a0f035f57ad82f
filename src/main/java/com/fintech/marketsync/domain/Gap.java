package com.fintech.marketsync.domain;

/**
 * Missing run of buckets between two known candles, in epoch seconds.
 *
 * @param startTs last known candle before the hole
 * @param endTs newest candle the source reports
 */
public record Gap(long startTs, long endTs) {

    public Gap {
        if (endTs < startTs) {
            throw new IllegalArgumentException("Gap end (" + endTs + ") before start (" + startTs + ")");
        }
    }

    /** Number of buckets expected strictly after startTs up to and including endTs. */
    public long expectedCandles(int minutes) {
        return (endTs - startTs) / (minutes * 60L);
    }
}
