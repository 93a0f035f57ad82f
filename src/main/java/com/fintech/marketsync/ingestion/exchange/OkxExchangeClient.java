package com.fintech.marketsync.ingestion.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * OKX v5 public market data over the JDK HTTP client.
 *
 * Recent candles come from {@code /api/v5/market/candles}; time-anchored pages come
 * from {@code /api/v5/market/history-candles}. OKX returns rows newest first, this
 * client returns them ascending.
 */
@Component
public class OkxExchangeClient implements ExchangeClient {

    private static final Logger log = LoggerFactory.getLogger(OkxExchangeClient.class);

    private static final String RECENT_PATH = "/api/v5/market/candles";
    private static final String HISTORY_PATH = "/api/v5/market/history-candles";
    private static final String RATE_LIMIT_CODE = "50011";
    private static final int PROVIDER_MAX_LIMIT = 300;
    private static final int HISTORY_MAX_LIMIT = 100;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final int pageLimit;
    private final int historyPageLimit;

    public OkxExchangeClient(HttpClient httpClient, ObjectMapper objectMapper, MarketDataProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = properties.getExchange().getBaseUrl();
        this.requestTimeout = Duration.ofMillis(properties.getExchange().getRequestTimeoutMs());
        this.pageLimit = Math.min(properties.getExchange().getPageLimit(), PROVIDER_MAX_LIMIT);
        this.historyPageLimit = Math.min(pageLimit, HISTORY_MAX_LIMIT);
    }

    @Override
    public int maxPageSize() {
        return pageLimit;
    }

    @Override
    public int maxHistoryPageSize() {
        return historyPageLimit;
    }

    @Override
    public List<ExchangeCandle> fetchCandles(String symbol, int minutes, int limit, Long sinceMs) {
        String bar = Timeframe.fromMinutes(minutes)
            .map(Timeframe::exchangeBar)
            .orElseThrow(() -> new IllegalArgumentException("Unsupported timeframe for exchange: " + minutes));
        HttpRequest request = HttpRequest.newBuilder()
            .uri(candlesUri(symbol, bar, minutes, limit, sinceMs))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExchangeNetworkException("OKX request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeNetworkException("OKX request interrupted", e);
        }

        if (response.statusCode() == 429) {
            throw new RateLimitedException("OKX rate limit: symbol=" + symbol + ", bar=" + bar);
        }
        if (response.statusCode() >= 500) {
            throw new ExchangeNetworkException("OKX HTTP " + response.statusCode());
        }
        if (response.statusCode() != 200) {
            throw new MalformedResponseException("OKX HTTP " + response.statusCode() + ": " + response.body());
        }
        return parse(response.body(), symbol, bar);
    }

    /**
     * The history endpoint answers at most 100 rows and returns the newest rows of the
     * before/after window, so the window is sized to the capped limit.
     */
    URI candlesUri(String symbol, String bar, int minutes, int limit, Long sinceMs) {
        int cap = sinceMs == null ? pageLimit : historyPageLimit;
        int effectiveLimit = Math.max(1, Math.min(limit, cap));

        StringBuilder url = new StringBuilder(baseUrl)
            .append(sinceMs == null ? RECENT_PATH : HISTORY_PATH)
            .append("?instId=").append(URLEncoder.encode(symbol, StandardCharsets.UTF_8))
            .append("&bar=").append(bar)
            .append("&limit=").append(effectiveLimit);
        if (sinceMs != null) {
            long after = sinceMs + effectiveLimit * minutes * 60_000L;
            url.append("&before=").append(sinceMs - 1).append("&after=").append(after);
        }
        return URI.create(url.toString());
    }

    List<ExchangeCandle> parse(String body, String symbol, String bar) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("OKX response is not JSON", e);
        }
        String code = root.path("code").asText("");
        if (RATE_LIMIT_CODE.equals(code)) {
            throw new RateLimitedException("OKX rate limit code " + code + ": symbol=" + symbol + ", bar=" + bar);
        }
        if (!"0".equals(code)) {
            throw new MalformedResponseException("OKX error code=" + code + ", msg=" + root.path("msg").asText());
        }
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            throw new MalformedResponseException("OKX response has no data array");
        }

        List<ExchangeCandle> rows = new ArrayList<>(data.size());
        for (JsonNode row : data) {
            if (!row.isArray()) {
                rows.add(new ExchangeCandle(null));
                continue;
            }
            List<String> fields = new ArrayList<>(row.size());
            row.forEach(field -> fields.add(field.isNull() ? null : field.asText()));
            rows.add(new ExchangeCandle(fields));
        }
        rows.sort(Comparator.comparingLong(OkxExchangeClient::timestampOrMax));
        log.debug("OKX candles fetched: symbol={}, bar={}, rows={}", symbol, bar, rows.size());
        return rows;
    }

    private static long timestampOrMax(ExchangeCandle row) {
        try {
            String ts = row.field(0);
            return ts != null ? Long.parseLong(ts) : Long.MAX_VALUE;
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
