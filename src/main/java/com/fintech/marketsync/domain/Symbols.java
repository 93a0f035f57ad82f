package com.fintech.marketsync.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Instrument id helpers.
 */
public final class Symbols {

    private static final String SWAP_SUFFIX = "-SWAP";

    private Symbols() {
    }

    /**
     * Storage-safe name for an instrument id: "BTC-USDT-SWAP" becomes "btc_usdt".
     * Used as the per-symbol durable table name.
     */
    public static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or blank");
        }
        String base = symbol.trim();
        if (base.toUpperCase(Locale.ROOT).endsWith(SWAP_SUFFIX)) {
            base = base.substring(0, base.length() - SWAP_SUFFIX.length());
        }
        return Arrays.stream(base.split("-"))
            .filter(part -> !part.isEmpty())
            .map(part -> part.toLowerCase(Locale.ROOT))
            .collect(Collectors.joining("_"));
    }
}
