package com.fintech.marketsync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized configuration for the market data sync service.
 * Maps to 'market-data.*' properties in application.yml. Missing required
 * settings fail the application context at startup.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "market-data")
public class MarketDataProperties {

    @NotEmpty
    private List<String> symbols = List.of("BTC-USDT-SWAP", "ETH-USDT-SWAP", "SOL-USDT-SWAP");

    /** Timeframes in minutes. */
    @NotEmpty
    private List<Integer> timeframes = List.of(1, 3, 5, 15, 30, 60, 240);

    @Valid
    private Series series = new Series();
    @Valid
    private Indicators indicators = new Indicators();
    @Valid
    private Polling polling = new Polling();
    @Valid
    private Streaming streaming = new Streaming();
    @Valid
    private Exchange exchange = new Exchange();
    @Valid
    private DurableStore durableStore = new DurableStore();
    @Valid
    private Lock lock = new Lock();

    private String displayZone = "Asia/Seoul";

    @Data
    public static class Series {
        @Min(1)
        private int maxLen = 3000;
        private long gapBackfillCap = 1000;
        private double gapThresholdFactor = 1.5;
    }

    @Data
    public static class Indicators {
        @Min(1)
        private int minCandles = 199;
        @Min(0)
        private int warmUpCount = 199;
        private int autoTrendMinCandles = 30;
        /** Finer timeframe minutes to the coarser timeframe minutes it reads trend from. */
        private Map<Integer, Integer> autoTrendSource = new LinkedHashMap<>(Map.of(
            1, 30, 3, 30, 5, 30, 15, 240, 30, 240, 60, 240, 240, 1440));
    }

    @Data
    public static class Polling {
        private boolean enabled = true;
        private boolean initialLoadEnabled = true;
        private long tickMs = 1000L;
        private int completedCandles = 10;
        private int barEndOffsetSeconds = 2;
        private int barEndWindowSeconds = 3;
        private long completedMinSpacingMs = 5000L;
        private long healthCheckIntervalMs = 300_000L;
        private long statsLogIntervalMs = 600_000L;
    }

    @Data
    public static class Streaming {
        private boolean enabled = true;
        @NotBlank
        private String url = "wss://ws.okx.com:8443/ws/v5/business";
        private long heartbeatMs = 20_000L;
        private long statusIntervalMs = 300_000L;
        private long reconnectDelayMs = 5_000L;
        private long saveIntervalMs = 5_000L;
        private int bufferSize = 1024;
        private String waitStrategy = "BLOCKING";
    }

    @Data
    public static class Exchange {
        @NotBlank
        private String baseUrl = "https://www.okx.com";
        @Min(1)
        private int pageLimit = 300;
        private long pageDelayMs = 500L;
        @Min(1)
        private int maxAttempts = 5;
        private long baseDelayMs = 1000L;
        private long requestTimeoutMs = 10_000L;
    }

    @Data
    public static class DurableStore {
        private boolean enabled = true;
        @NotBlank
        private String url;
        @NotBlank
        private String username;
        @NotBlank
        private String password;
        private int minPoolSize = 1;
        private int maxPoolSize = 10;
        @Min(0)
        private int maxRetries = 3;
        private long baseDelayMs = 1000L;
        private long healthCheckIntervalMs = 60_000L;
    }

    @Data
    public static class Lock {
        private long ttlMs = 30_000L;
        private long initialLoadTtlMs = 600_000L;
    }
}
