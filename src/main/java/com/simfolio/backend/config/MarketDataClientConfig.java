package com.simfolio.backend.config;

import com.simfolio.backend.exception.MarketDataRateLimitException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Wires the Finnhub transport: one RestTemplate plus the rate limiter, circuit breaker and
 * retry that {@code FinnhubHttpClient} stacks around every call, all named {@value #PROVIDER}.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MarketDataClientConfig {

    static final String PROVIDER = "finnhub";

    private final FinnhubProperties properties;

    @Bean
    public RestTemplate finnhubRestTemplate() {
        FinnhubProperties.Http http = properties.getApi().getHttp();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(http.getConnectTimeoutMs());
        factory.setReadTimeout(http.getReadTimeoutMs());
        if (!properties.hasApiKey()) {
            log.warn("finnhub.api.api-key is blank, quotes and sector lookups will be unavailable");
        }
        return new RestTemplate(factory);
    }

    @Bean
    public CircuitBreaker finnhubCircuitBreaker() {
        FinnhubProperties.Circuit circuit = properties.getResilience().getCircuit();
        CircuitBreaker breaker = CircuitBreaker.of(PROVIDER, CircuitBreakerConfig.custom()
                .failureRateThreshold(circuit.getFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(circuit.getWaitOpenSeconds()))
                .slidingWindowSize(circuit.getSlidingWindowSize())
                // throttling is not an outage
                .ignoreExceptions(MarketDataRateLimitException.class)
                .build());
        breaker.getEventPublisher().onStateTransition(event ->
                log.warn("Finnhub circuit breaker {}", event.getStateTransition()));
        return breaker;
    }

    @Bean
    public RateLimiter finnhubRateLimiter() {
        FinnhubProperties.Rate rate = properties.getResilience().getRate();
        return RateLimiter.of(PROVIDER, RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rate.getLimitPerSecond())
                .timeoutDuration(Duration.ofMillis(rate.getTimeoutMs()))
                .build());
    }

    @Bean
    public Retry finnhubRetry() {
        FinnhubProperties.Retry retry = properties.getResilience().getRetry();
        Retry finnhubRetry = Retry.of(PROVIDER, RetryConfig.custom()
                .maxAttempts(retry.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Duration.ofMillis(retry.getBaseDelayMs()), 2.0, retry.getJitterFactor()))
                .retryExceptions(MarketDataRateLimitException.class, ResourceAccessException.class,
                        HttpServerErrorException.class)
                .build());
        finnhubRetry.getEventPublisher().onRetry(event ->
                log.debug("Retrying Finnhub call, attempt {} after {}", event.getNumberOfRetryAttempts(),
                        event.getWaitInterval()));
        return finnhubRetry;
    }
}
