package com.fintech.marketsync.ingestion.exchange;

import java.util.List;

/**
 * One candle row exactly as the exchange sent it. Fields may be null or
 * non-numeric; validation happens in the fetcher.
 *
 * @param fields ts(ms), open, high, low, close, volume, then provider-specific extras
 */
public record ExchangeCandle(List<String> fields) {

    public static final int MIN_FIELDS = 6;

    public String field(int index) {
        return fields != null && index < fields.size() ? fields.get(index) : null;
    }

    /** Provider "confirm" flag: "1" once the bar has closed. Last field when present. */
    public boolean confirmed() {
        if (fields == null || fields.size() <= MIN_FIELDS) {
            return false;
        }
        return "1".equals(fields.get(fields.size() - 1));
    }
}
