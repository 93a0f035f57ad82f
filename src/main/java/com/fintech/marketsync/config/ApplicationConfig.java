package com.fintech.marketsync.config;

import com.fintech.marketsync.ingestion.CandleFetcher;
import com.fintech.marketsync.ingestion.exchange.ExchangeNetworkException;
import com.fintech.marketsync.ingestion.exchange.RateLimitedException;
import com.fintech.marketsync.persistence.DurableCandleWriter;
import com.fintech.marketsync.util.DisplayTimeFormatter;
import com.fintech.marketsync.util.TimeWindowManager;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TimeWindowManager timeWindowManager(MarketDataProperties properties) {
        return new TimeWindowManager(
            properties.getPolling().getBarEndOffsetSeconds(),
            properties.getPolling().getBarEndWindowSeconds());
    }

    @Bean
    public DisplayTimeFormatter displayTimeFormatter(MarketDataProperties properties) {
        return new DisplayTimeFormatter(ZoneId.of(properties.getDisplayZone()));
    }

    @Bean
    public HttpClient httpClient(MarketDataProperties properties) {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getExchange().getRequestTimeoutMs()))
            .build();
    }

    /**
     * Exponential backoff, doubling from the base delay.
     * Exchange calls retry on rate limiting and network failures only; durable store
     * calls retry on connection-class failures only.
     */
    @Bean
    public RetryRegistry retryRegistry(MarketDataProperties properties) {
        MarketDataProperties.Exchange exchange = properties.getExchange();
        RetryConfig exchangeConfig = RetryConfig.custom()
            .maxAttempts(exchange.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(exchange.getBaseDelayMs()), 2.0))
            .retryExceptions(RateLimitedException.class, ExchangeNetworkException.class)
            .build();

        MarketDataProperties.DurableStore durable = properties.getDurableStore();
        RetryConfig durableConfig = RetryConfig.custom()
            .maxAttempts(durable.getMaxRetries() + 1)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(durable.getBaseDelayMs()), 2.0))
            .retryOnException(DurableCandleWriter::isConnectionError)
            .build();

        return RetryRegistry.of(Map.of(
            CandleFetcher.RETRY_NAME, exchangeConfig,
            DurableCandleWriter.RETRY_NAME, durableConfig));
    }
}
