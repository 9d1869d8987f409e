package com.simfolio.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class Portfolio {
    Long userId;
    BigDecimal balance;
    BigDecimal startingBalance;
    List<Position> positions;
    BigDecimal totalMarketValue;
    BigDecimal totalUnrealizedPnL;
    BigDecimal totalEquity;
    BigDecimal totalReturn;
    BigDecimal totalReturnPercent;
}
