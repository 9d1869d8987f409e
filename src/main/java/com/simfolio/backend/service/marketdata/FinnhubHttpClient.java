package com.simfolio.backend.service.marketdata;

import com.simfolio.backend.config.FinnhubProperties;
import com.simfolio.backend.exception.MarketDataDegradedException;
import com.simfolio.backend.exception.MarketDataRateLimitException;
import com.simfolio.backend.service.MetricsService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.function.Supplier;

/**
 * GET-only Finnhub REST client. Every call is rate limited, guarded by a circuit breaker and
 * retried on throttling and transient server/network errors; whatever still fails surfaces
 * as {@link MarketDataDegradedException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FinnhubHttpClient {

    private static final String TOKEN_HEADER = "X-Finnhub-Token";

    private final RestTemplate finnhubRestTemplate;
    private final CircuitBreaker finnhubCircuitBreaker;
    private final RateLimiter finnhubRateLimiter;
    private final Retry finnhubRetry;
    private final MetricsService metricsService;
    private final MeterRegistry meterRegistry;
    private final FinnhubProperties properties;

    public boolean isConfigured() {
        return properties.hasApiKey();
    }

    public String get(String path, String symbol) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getApi().getBaseUrl())
                .path(path)
                .queryParam("symbol", symbol)
                .build()
                .encode()
                .toUri();
        return execute(uri, path);
    }

    private String execute(URI uri, String endpoint) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        Supplier<String> supplier = () -> doRequest(uri);
        try {
            Supplier<String> decorated = Retry.decorateSupplier(finnhubRetry, supplier);
            decorated = CircuitBreaker.decorateSupplier(finnhubCircuitBreaker, decorated);
            decorated = RateLimiter.decorateSupplier(finnhubRateLimiter, decorated);
            String response = decorated.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            throw failure(endpoint, "CIRCUIT_OPEN", new MarketDataDegradedException("Finnhub circuit breaker open", e));
        } catch (RequestNotPermitted e) {
            throw failure(endpoint, "RATE_LIMIT", new MarketDataRateLimitException("Finnhub local rate limit reached", e));
        } catch (MarketDataDegradedException e) {
            throw failure(endpoint, e instanceof MarketDataRateLimitException ? "RATE_LIMIT" : "HTTP_ERROR", e);
        } catch (HttpServerErrorException e) {
            throw failure(endpoint, "SERVER_ERROR", new MarketDataDegradedException(
                    "Finnhub server error (" + e.getStatusCode().value() + ")", e));
        } catch (RestClientException e) {
            throw failure(endpoint, "NETWORK", new MarketDataDegradedException("Finnhub unreachable: " + e.getMessage(), e));
        } finally {
            sample.stop(Timer.builder("market_data_call_latency")
                    .tag("provider", "FINNHUB")
                    .tag("endpoint", endpoint)
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(URI uri) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.set(TOKEN_HEADER, properties.getApi().getApiKey());
            ResponseEntity<String> response = finnhubRestTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Finnhub rate limit 429 for {}", uri.getPath());
            throw new MarketDataRateLimitException("Finnhub rate limit", e);
        } catch (HttpServerErrorException | ResourceAccessException e) {
            log.warn("Finnhub transient error for {}: {}", uri.getPath(), e.getMessage());
            throw e;
        } catch (HttpClientErrorException e) {
            throw new MarketDataDegradedException("Finnhub API error (" + e.getStatusCode().value() + ")", e);
        }
    }

    private MarketDataDegradedException failure(String endpoint, String reason, MarketDataDegradedException e) {
        log.warn("Finnhub request failed endpoint={} reason={} message={}", endpoint, reason, e.getMessage());
        metricsService.recordMarketDataFailure(reason);
        return e;
    }
}
