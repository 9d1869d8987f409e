package com.simfolio.backend.dto;

import com.simfolio.backend.model.Position;
import com.simfolio.backend.util.MoneyUtils;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class PositionDTO {
    private String symbol;
    private long netQty;
    private BigDecimal avgCost;
    private BigDecimal currentPrice;
    private BigDecimal marketValue;
    private BigDecimal unrealizedPnL;
    private BigDecimal gainPercent;
    private BigDecimal allocationPercent;

    public static PositionDTO from(Position position) {
        return PositionDTO.builder()
                .symbol(position.getSymbol())
                .netQty(position.getNetQuantity())
                .avgCost(MoneyUtils.scale(position.getAvgCost()))
                .currentPrice(MoneyUtils.scale(position.getCurrentPrice()))
                .marketValue(MoneyUtils.scale(position.getMarketValue()))
                .unrealizedPnL(MoneyUtils.scale(position.getUnrealizedPnL()))
                .gainPercent(MoneyUtils.roundPercent(position.getGainPercent()))
                .allocationPercent(MoneyUtils.roundPercent(position.getAllocationPercent()))
                .build();
    }
}
