package com.simfolio.backend.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "simfolio.trading")
@Data
@Validated
public class TradingProperties {

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal defaultStartingBalance = new BigDecimal("100000");

    /** Upper bound for the account lock + store transaction of a single trade. */
    @Min(1)
    private int commitTimeoutSeconds = 10;
}
