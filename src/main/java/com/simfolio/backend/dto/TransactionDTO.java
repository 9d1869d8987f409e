package com.simfolio.backend.dto;

import com.simfolio.backend.model.LedgerTransaction;
import com.simfolio.backend.model.TransactionType;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
public class TransactionDTO {
    private Long id;
    private String symbol;
    private TransactionType type;
    private int quantity;
    private BigDecimal price;
    private BigDecimal totalAmount;
    private Instant createdAt;

    public static TransactionDTO from(LedgerTransaction txn) {
        return TransactionDTO.builder()
                .id(txn.getId())
                .symbol(txn.getSymbol())
                .type(txn.getType())
                .quantity(txn.getQuantity())
                .price(txn.getPrice())
                .totalAmount(txn.getTotalAmount())
                .createdAt(txn.getCreatedAt())
                .build();
    }
}
