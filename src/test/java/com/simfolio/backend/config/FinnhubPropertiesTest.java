package com.simfolio.backend.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class FinnhubPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConfigurationPropertiesAutoConfiguration.class, ValidationAutoConfiguration.class))
            .withUserConfiguration(FinnhubProperties.class, MarketDataClientConfig.class);

    @Test
    void defaultsApplyWhenNothingIsConfigured() {
        runner.run(context -> {
            FinnhubProperties properties = context.getBean(FinnhubProperties.class);

            assertThat(properties.getApi().getBaseUrl()).isEqualTo("https://finnhub.io/api/v1");
            assertThat(properties.hasApiKey()).isFalse();
            assertThat(properties.getApi().getHttp().getReadTimeoutMs()).isEqualTo(5000);
            assertThat(properties.getResilience().getRetry().getMaxAttempts()).isEqualTo(3);
            assertThat(context).hasSingleBean(RestTemplate.class);
        });
    }

    @Test
    void resilienceBeansFollowBoundSettings() {
        runner.withPropertyValues(
                        "finnhub.api.api-key=abc",
                        "finnhub.resilience.circuit.failure-rate-threshold=40",
                        "finnhub.resilience.circuit.wait-open-seconds=12",
                        "finnhub.resilience.circuit.sliding-window-size=8",
                        "finnhub.resilience.rate.limit-per-second=7",
                        "finnhub.resilience.rate.timeout-ms=250",
                        "finnhub.resilience.retry.max-attempts=5")
                .run(context -> {
                    assertThat(context.getBean(FinnhubProperties.class).hasApiKey()).isTrue();

                    CircuitBreaker breaker = context.getBean(CircuitBreaker.class);
                    assertThat(breaker.getCircuitBreakerConfig().getFailureRateThreshold()).isEqualTo(40f);
                    assertThat(breaker.getCircuitBreakerConfig().getSlidingWindowSize()).isEqualTo(8);

                    RateLimiter limiter = context.getBean(RateLimiter.class);
                    assertThat(limiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(7);
                    assertThat(limiter.getRateLimiterConfig().getTimeoutDuration()).isEqualTo(Duration.ofMillis(250));

                    assertThat(context.getBean(Retry.class).getRetryConfig().getMaxAttempts()).isEqualTo(5);
                });
    }

    @Test
    void invalidSettingsFailStartup() {
        runner.withPropertyValues("finnhub.resilience.retry.jitter-factor=1.5")
                .run(context -> assertThat(context).hasFailed());
        runner.withPropertyValues("finnhub.resilience.rate.limit-per-second=0")
                .run(context -> assertThat(context).hasFailed());
        runner.withPropertyValues("finnhub.api.base-url=")
                .run(context -> assertThat(context).hasFailed());
    }
}
