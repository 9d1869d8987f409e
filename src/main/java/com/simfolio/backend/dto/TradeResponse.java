package com.simfolio.backend.dto;

import com.simfolio.backend.model.TransactionType;
import com.simfolio.backend.service.TradeExecutionService.TradeResult;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class TradeResponse {
    private Long transactionId;
    private String symbol;
    private TransactionType type;
    private int quantity;
    private BigDecimal price;
    private BigDecimal totalAmount;
    private BigDecimal newBalance;

    public static TradeResponse from(TradeResult result) {
        return TradeResponse.builder()
                .transactionId(result.transactionId())
                .symbol(result.symbol())
                .type(result.type())
                .quantity(result.quantity())
                .price(result.price())
                .totalAmount(result.totalAmount())
                .newBalance(result.newBalance())
                .build();
    }
}
