package com.fintech.marketsync.support;

import com.fintech.marketsync.ingestion.exchange.ExchangeCandle;
import com.fintech.marketsync.ingestion.exchange.ExchangeClient;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable exchange. Rows are kept per (symbol, minutes) keyed by epoch millis;
 * queued failures are thrown before any data is served.
 */
public class FakeExchangeClient implements ExchangeClient {

    private final Map<String, TreeMap<Long, ExchangeCandle>> rows = new HashMap<>();
    private final Deque<RuntimeException> failures = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final List<Long> sinceArguments = new ArrayList<>();
    private final int pageSize;
    private final int historyPageSize;
    private final boolean windowedHistory;

    public FakeExchangeClient(int pageSize) {
        this.pageSize = pageSize;
        this.historyPageSize = pageSize;
        this.windowedHistory = false;
    }

    /**
     * Time-anchored calls behave like a capped archive endpoint: the request covers
     * {@code limit} buckets from sinceMs and only the newest historyPageSize rows of
     * that window come back.
     */
    public FakeExchangeClient(int pageSize, int historyPageSize) {
        this.pageSize = pageSize;
        this.historyPageSize = historyPageSize;
        this.windowedHistory = true;
    }

    public void addCandle(String symbol, int minutes, long tsSeconds, double close, double volume, boolean confirmed) {
        List<String> fields = List.of(
            String.valueOf(tsSeconds * 1000L),
            String.valueOf(close),
            String.valueOf(close + 1),
            String.valueOf(close - 1),
            String.valueOf(close),
            String.valueOf(volume),
            "0", "0",
            confirmed ? "1" : "0");
        series(symbol, minutes).put(tsSeconds * 1000L, new ExchangeCandle(fields));
    }

    /** Adds count closed candles starting at startTs, one bucket apart. */
    public void addSeries(String symbol, int minutes, long startTs, int count) {
        for (int i = 0; i < count; i++) {
            addCandle(symbol, minutes, startTs + i * minutes * 60L, 100 + Math.sin(i / 5.0) * 10, 10 + i % 7, true);
        }
    }

    public void addRawRow(String symbol, int minutes, long tsSeconds, List<String> fields) {
        series(symbol, minutes).put(tsSeconds * 1000L, new ExchangeCandle(fields));
    }

    public void failNext(RuntimeException failure) {
        failures.add(failure);
    }

    public int calls() {
        return calls.get();
    }

    public List<Long> sinceArguments() {
        return sinceArguments;
    }

    @Override
    public synchronized List<ExchangeCandle> fetchCandles(String symbol, int minutes, int limit, Long sinceMs) {
        calls.incrementAndGet();
        sinceArguments.add(sinceMs);
        if (!failures.isEmpty()) {
            throw failures.poll();
        }
        TreeMap<Long, ExchangeCandle> all = series(symbol, minutes);
        int effective = Math.min(limit, pageSize);
        List<ExchangeCandle> page = new ArrayList<>();
        if (sinceMs == null) {
            NavigableMap<Long, ExchangeCandle> newest = all.descendingMap();
            for (ExchangeCandle row : newest.values()) {
                if (page.size() == effective) {
                    break;
                }
                page.add(0, row);
            }
        } else if (windowedHistory) {
            long windowEnd = sinceMs + limit * minutes * 60_000L;
            for (ExchangeCandle row : all.subMap(sinceMs, true, windowEnd, false).descendingMap().values()) {
                if (page.size() == Math.min(limit, historyPageSize)) {
                    break;
                }
                page.add(0, row);
            }
        } else {
            for (ExchangeCandle row : all.tailMap(sinceMs, true).values()) {
                if (page.size() == effective) {
                    break;
                }
                page.add(row);
            }
        }
        return page;
    }

    @Override
    public int maxPageSize() {
        return pageSize;
    }

    @Override
    public int maxHistoryPageSize() {
        return historyPageSize;
    }

    private TreeMap<Long, ExchangeCandle> series(String symbol, int minutes) {
        return rows.computeIfAbsent(symbol + ":" + minutes, k -> new TreeMap<>());
    }
}
