package com.simfolio.backend.dto;

import com.simfolio.backend.model.Account;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
public class AccountDTO {
    private Long userId;
    private BigDecimal startingBalance;
    private BigDecimal cashBalance;
    private Instant createdAt;
    private Instant updatedAt;

    public static AccountDTO from(Account account) {
        return AccountDTO.builder()
                .userId(account.getUserId())
                .startingBalance(account.getStartingBalance())
                .cashBalance(account.getCashBalance())
                .createdAt(account.getCreatedAt())
                .updatedAt(account.getUpdatedAt())
                .build();
    }
}
