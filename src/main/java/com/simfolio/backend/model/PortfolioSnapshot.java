package com.simfolio.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Risk and allocation summary of one portfolio at read time. Values are already rounded:
 * percentages to 2 places, volatility and Sharpe ratio to 4.
 */
@Value
@Builder
public class PortfolioSnapshot {
    BigDecimal totalEquity;
    BigDecimal totalReturnPct;
    String displayTotalReturnPct;
    BigDecimal cashAllocationPct;
    LargestPosition largestPosition;
    ConcentrationRiskLevel concentrationRiskLevel;
    List<SectorAllocation> sectorBreakdown;
    double volatility;
    double sharpeRatio;
    BigDecimal annualizedReturnPct;
    String topGainer;
    String topLoser;

    public record LargestPosition(String symbol, BigDecimal allocationPct) {}

    public record SectorAllocation(String sector, BigDecimal allocationPct) {}
}
