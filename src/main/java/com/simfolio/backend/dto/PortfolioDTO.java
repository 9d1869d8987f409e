package com.simfolio.backend.dto;

import com.simfolio.backend.model.Portfolio;
import com.simfolio.backend.util.MoneyUtils;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
public class PortfolioDTO {
    private BigDecimal balance;
    private BigDecimal startingBalance;
    private List<PositionDTO> positions;
    private BigDecimal totalMarketValue;
    private BigDecimal totalUnrealizedPnL;
    private BigDecimal totalEquity;
    private BigDecimal totalReturn;
    private BigDecimal totalReturnPercent;

    public static PortfolioDTO from(Portfolio portfolio) {
        return PortfolioDTO.builder()
                .balance(MoneyUtils.scale(portfolio.getBalance()))
                .startingBalance(MoneyUtils.scale(portfolio.getStartingBalance()))
                .positions(portfolio.getPositions().stream().map(PositionDTO::from).toList())
                .totalMarketValue(MoneyUtils.scale(portfolio.getTotalMarketValue()))
                .totalUnrealizedPnL(MoneyUtils.scale(portfolio.getTotalUnrealizedPnL()))
                .totalEquity(MoneyUtils.scale(portfolio.getTotalEquity()))
                .totalReturn(MoneyUtils.scale(portfolio.getTotalReturn()))
                .totalReturnPercent(MoneyUtils.roundPercent(portfolio.getTotalReturnPercent()))
                .build();
    }
}
