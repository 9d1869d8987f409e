package com.simfolio.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Finnhub connection and resilience settings. A blank api key leaves the quote and sector
 * lookups disabled rather than failing startup.
 */
@Configuration
@ConfigurationProperties(prefix = "finnhub")
@Data
@Validated
public class FinnhubProperties {

    @Valid
    @NotNull
    private Api api = new Api();

    @Valid
    @NotNull
    private Resilience resilience = new Resilience();

    public boolean hasApiKey() {
        return api.getApiKey() != null && !api.getApiKey().isBlank();
    }

    @Data
    public static class Api {

        @NotBlank
        private String baseUrl = "https://finnhub.io/api/v1";

        private String apiKey = "";

        @Valid
        @NotNull
        private Http http = new Http();
    }

    @Data
    public static class Http {

        @Min(1)
        private int connectTimeoutMs = 5000;

        @Min(1)
        private int readTimeoutMs = 5000;
    }

    @Data
    public static class Resilience {

        @Valid
        @NotNull
        private Circuit circuit = new Circuit();

        @Valid
        @NotNull
        private Rate rate = new Rate();

        @Valid
        @NotNull
        private Retry retry = new Retry();
    }

    @Data
    public static class Circuit {

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("100.0")
        private float failureRateThreshold = 50;

        @Min(1)
        private long waitOpenSeconds = 30;

        @Min(1)
        private int slidingWindowSize = 20;
    }

    @Data
    public static class Rate {

        @Min(1)
        private int limitPerSecond = 25;

        /** How long a caller waits for a permit before the call is refused locally. */
        @Min(0)
        private long timeoutMs = 500;
    }

    @Data
    public static class Retry {

        @Min(1)
        private int maxAttempts = 3;

        @Min(1)
        private long baseDelayMs = 200;

        @DecimalMin("0.0")
        @DecimalMax(value = "1.0", inclusive = false)
        private double jitterFactor = 0.2;
    }
}
