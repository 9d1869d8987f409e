package com.simfolio.backend.dto;

import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenAccountRequest {
    /** Defaults to the configured starting balance when omitted. */
    @DecimalMin(value = "0.0", inclusive = false, message = "Starting balance must be greater than zero")
    private BigDecimal startingBalance;
}
