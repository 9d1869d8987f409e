package com.simfolio.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "simfolio.analytics")
@Data
@Validated
public class AnalyticsProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double riskFreeRate = 0.03;

    @Min(1)
    private int tradingDaysPerYear = 252;

    /** Null keeps sector lookups for the life of the process. */
    private Duration sectorCacheTtl;

    private Concentration concentration = new Concentration();

    @Data
    public static class Concentration {
        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private BigDecimal highPct = new BigDecimal("40");

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private BigDecimal mediumPct = new BigDecimal("25");
    }
}
