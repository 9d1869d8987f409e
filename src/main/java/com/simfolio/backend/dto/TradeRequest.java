package com.simfolio.backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRequest {

    @NotBlank(message = "Invalid symbol")
    @Size(max = 32, message = "Invalid symbol")
    private String symbol;

    @NotBlank(message = "Invalid type. Must be BUY or SELL")
    private String type;

    @NotNull(message = "Invalid quantity. Must be a positive number")
    @Min(value = 1, message = "Invalid quantity. Must be a positive number")
    private Integer quantity;
}
