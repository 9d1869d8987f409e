package com.simfolio.backend.service.analytics;

import com.simfolio.backend.config.AnalyticsProperties;
import com.simfolio.backend.model.ConcentrationRiskLevel;
import com.simfolio.backend.model.Portfolio;
import com.simfolio.backend.model.PortfolioSnapshot;
import com.simfolio.backend.model.PortfolioSnapshot.LargestPosition;
import com.simfolio.backend.model.PortfolioSnapshot.SectorAllocation;
import com.simfolio.backend.model.Position;
import com.simfolio.backend.service.PortfolioService;
import com.simfolio.backend.service.SectorService;
import com.simfolio.backend.service.ledger.EquityCurveBuilder;
import com.simfolio.backend.service.ledger.EquityPoint;
import com.simfolio.backend.service.ledger.LedgerSnapshot;
import com.simfolio.backend.service.ledger.LedgerStore;
import com.simfolio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the read-only {@link PortfolioSnapshot}: allocation, concentration, sectors and
 * risk-adjusted return. Nothing here writes to the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioAnalyticsService {

    private static final int RATIO_PLACES = 4;

    private final LedgerStore ledgerStore;
    private final PortfolioService portfolioService;
    private final EquityCurveBuilder equityCurveBuilder;
    private final ReturnStatisticsCalculator statistics;
    private final SectorService sectorService;
    private final AnalyticsProperties properties;

    public PortfolioSnapshot buildSnapshot(Long userId) {
        LedgerSnapshot ledger = ledgerStore.readLedger(userId);
        Portfolio portfolio = portfolioService.valuate(ledger.account(), ledger.transactions());
        List<EquityPoint> curve = equityCurveBuilder.build(ledger.account().getStartingBalance(), ledger.transactions());
        return snapshotOf(portfolio, curve);
    }

    PortfolioSnapshot snapshotOf(Portfolio portfolio, List<EquityPoint> curve) {
        List<Position> positions = portfolio.getPositions();
        BigDecimal totalEquity = portfolio.getTotalEquity();

        Position largest = positions.stream()
                .max(Comparator.comparing(Position::getMarketValue))
                .orElse(null);
        BigDecimal largestPct = largest == null ? BigDecimal.ZERO : MoneyUtils.percentOf(largest.getMarketValue(), totalEquity);

        List<Double> dailyReturns = statistics.dailyReturns(curve);
        double volatility = statistics.volatility(dailyReturns);
        double annualizedReturn = statistics.annualizedReturn(statistics.totalReturn(curve), dailyReturns.size());
        double sharpe = statistics.sharpeRatio(annualizedReturn, volatility);

        BigDecimal totalReturnPct = MoneyUtils.roundPercent(portfolio.getTotalReturnPercent());
        GainerLoser movers = gainerAndLoser(positions);

        return PortfolioSnapshot.builder()
                .totalEquity(MoneyUtils.scale(totalEquity))
                .totalReturnPct(totalReturnPct)
                .displayTotalReturnPct(totalReturnPct.stripTrailingZeros().toPlainString() + "%")
                .cashAllocationPct(MoneyUtils.roundPercent(MoneyUtils.percentOf(portfolio.getBalance(), totalEquity)))
                .largestPosition(largest == null ? null
                        : new LargestPosition(largest.getSymbol(), MoneyUtils.roundPercent(largestPct)))
                .concentrationRiskLevel(classifyConcentration(largest == null ? null : largestPct))
                .sectorBreakdown(sectorBreakdown(positions, totalEquity))
                .volatility(MoneyUtils.round(volatility, RATIO_PLACES))
                .sharpeRatio(MoneyUtils.round(sharpe, RATIO_PLACES))
                .annualizedReturnPct(MoneyUtils.roundPercent(BigDecimal.valueOf(annualizedReturn * 100)))
                .topGainer(movers.gainer())
                .topLoser(movers.loser())
                .build();
    }

    /**
     * Strictly above the high threshold is HIGH, strictly above the medium threshold is
     * MEDIUM; no position at all is LOW.
     */
    public ConcentrationRiskLevel classifyConcentration(BigDecimal largestAllocationPct) {
        if (largestAllocationPct == null) {
            return ConcentrationRiskLevel.LOW;
        }
        AnalyticsProperties.Concentration thresholds = properties.getConcentration();
        if (largestAllocationPct.compareTo(thresholds.getHighPct()) > 0) {
            return ConcentrationRiskLevel.HIGH;
        }
        if (largestAllocationPct.compareTo(thresholds.getMediumPct()) > 0) {
            return ConcentrationRiskLevel.MEDIUM;
        }
        return ConcentrationRiskLevel.LOW;
    }

    private List<SectorAllocation> sectorBreakdown(List<Position> positions, BigDecimal totalEquity) {
        Map<String, BigDecimal> bySector = new LinkedHashMap<>();
        for (Position position : positions) {
            bySector.merge(sectorService.getSector(position.getSymbol()), position.getMarketValue(), BigDecimal::add);
        }
        return bySector.entrySet().stream()
                .map(entry -> Map.entry(entry.getKey(), MoneyUtils.percentOf(entry.getValue(), totalEquity)))
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed())
                .map(entry -> new SectorAllocation(entry.getKey(), MoneyUtils.roundPercent(entry.getValue())))
                .toList();
    }

    /**
     * Ranks by gain percent, stable for ties; the loser is dropped when it is the gainer.
     */
    private GainerLoser gainerAndLoser(List<Position> positions) {
        if (positions.isEmpty()) {
            return new GainerLoser(null, null);
        }
        List<Position> ranked = positions.stream()
                .sorted(Comparator.comparing(Position::getGainPercent))
                .toList();
        String loser = ranked.get(0).getSymbol();
        String gainer = ranked.get(ranked.size() - 1).getSymbol();
        return new GainerLoser(gainer, gainer.equals(loser) ? null : loser);
    }

    private record GainerLoser(String gainer, String loser) {}
}
