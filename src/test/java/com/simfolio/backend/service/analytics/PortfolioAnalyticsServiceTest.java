package com.simfolio.backend.service.analytics;

import com.simfolio.backend.config.AnalyticsProperties;
import com.simfolio.backend.model.ConcentrationRiskLevel;
import com.simfolio.backend.model.Portfolio;
import com.simfolio.backend.model.PortfolioSnapshot;
import com.simfolio.backend.model.Position;
import com.simfolio.backend.service.PortfolioService;
import com.simfolio.backend.service.SectorService;
import com.simfolio.backend.service.ledger.EquityCurveBuilder;
import com.simfolio.backend.service.ledger.EquityPoint;
import com.simfolio.backend.service.ledger.LedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PortfolioAnalyticsServiceTest {

    private static final Instant T0 = Instant.parse("2024-02-01T15:00:00Z");

    private final SectorService sectorService = mock(SectorService.class);
    private PortfolioAnalyticsService service;

    @BeforeEach
    void setUp() {
        AnalyticsProperties properties = new AnalyticsProperties();
        service = new PortfolioAnalyticsService(
                mock(LedgerStore.class),
                mock(PortfolioService.class),
                mock(EquityCurveBuilder.class),
                new ReturnStatisticsCalculator(properties),
                sectorService,
                properties);
        when(sectorService.getSector("AAPL")).thenReturn("Technology");
        when(sectorService.getSector("MSFT")).thenReturn("Technology");
        when(sectorService.getSector("XOM")).thenReturn("Energy");
    }

    @Test
    void concentrationThresholdsAreExclusive() {
        assertThat(service.classifyConcentration(new BigDecimal("41"))).isEqualTo(ConcentrationRiskLevel.HIGH);
        assertThat(service.classifyConcentration(new BigDecimal("40.0001"))).isEqualTo(ConcentrationRiskLevel.HIGH);
        assertThat(service.classifyConcentration(new BigDecimal("40"))).isEqualTo(ConcentrationRiskLevel.MEDIUM);
        assertThat(service.classifyConcentration(new BigDecimal("26"))).isEqualTo(ConcentrationRiskLevel.MEDIUM);
        assertThat(service.classifyConcentration(new BigDecimal("25"))).isEqualTo(ConcentrationRiskLevel.LOW);
        assertThat(service.classifyConcentration(null)).isEqualTo(ConcentrationRiskLevel.LOW);
    }

    @Test
    void snapshotOfDiversifiedPortfolio() {
        Portfolio portfolio = portfolio("40000", "12.345",
                position("AAPL", "30000", "10"),
                position("MSFT", "10000", "-5"),
                position("XOM", "20000", "2.5"));

        PortfolioSnapshot snapshot = service.snapshotOf(portfolio, List.of(new EquityPoint(T0, new BigDecimal("100000"))));

        assertThat(snapshot.getTotalEquity()).isEqualByComparingTo("100000");
        assertThat(snapshot.getTotalReturnPct()).isEqualByComparingTo("12.35");
        assertThat(snapshot.getDisplayTotalReturnPct()).isEqualTo("12.35%");
        assertThat(snapshot.getCashAllocationPct()).isEqualByComparingTo("40.00");
        assertThat(snapshot.getLargestPosition().symbol()).isEqualTo("AAPL");
        assertThat(snapshot.getLargestPosition().allocationPct()).isEqualByComparingTo("30.00");
        assertThat(snapshot.getConcentrationRiskLevel()).isEqualTo(ConcentrationRiskLevel.MEDIUM);
        assertThat(snapshot.getSectorBreakdown())
                .extracting(PortfolioSnapshot.SectorAllocation::sector)
                .containsExactly("Technology", "Energy");
        assertThat(snapshot.getSectorBreakdown().get(0).allocationPct()).isEqualByComparingTo("40.00");
        assertThat(snapshot.getTopGainer()).isEqualTo("AAPL");
        assertThat(snapshot.getTopLoser()).isEqualTo("MSFT");
        assertThat(snapshot.getVolatility()).isZero();
        assertThat(snapshot.getSharpeRatio()).isZero();
    }

    @Test
    void singleLargePositionIsHighRiskAndHasNoLoser() {
        Portfolio portfolio = portfolio("45000", "5", position("AAPL", "55000", "3"));

        PortfolioSnapshot snapshot = service.snapshotOf(portfolio, List.of(new EquityPoint(T0, new BigDecimal("100000"))));

        assertThat(snapshot.getConcentrationRiskLevel()).isEqualTo(ConcentrationRiskLevel.HIGH);
        assertThat(snapshot.getDisplayTotalReturnPct()).isEqualTo("5%");
        assertThat(snapshot.getTopGainer()).isEqualTo("AAPL");
        assertThat(snapshot.getTopLoser()).isNull();
    }

    @Test
    void cashOnlyPortfolio() {
        Portfolio portfolio = portfolio("100000", "0");

        PortfolioSnapshot snapshot = service.snapshotOf(portfolio, List.of(new EquityPoint(T0, new BigDecimal("100000"))));

        assertThat(snapshot.getLargestPosition()).isNull();
        assertThat(snapshot.getConcentrationRiskLevel()).isEqualTo(ConcentrationRiskLevel.LOW);
        assertThat(snapshot.getCashAllocationPct()).isEqualByComparingTo("100");
        assertThat(snapshot.getSectorBreakdown()).isEmpty();
        assertThat(snapshot.getTopGainer()).isNull();
        assertThat(snapshot.getTopLoser()).isNull();
    }

    @Test
    void riskFiguresComeFromDailyEquity() {
        Portfolio portfolio = portfolio("100000", "0");
        List<EquityPoint> curve = List.of(
                new EquityPoint(T0, new BigDecimal("100000")),
                new EquityPoint(T0.plus(1, ChronoUnit.DAYS), new BigDecimal("101000")),
                new EquityPoint(T0.plus(2, ChronoUnit.DAYS), new BigDecimal("100495")),
                new EquityPoint(T0.plus(3, ChronoUnit.DAYS), new BigDecimal("102000"))
        );

        PortfolioSnapshot snapshot = service.snapshotOf(portfolio, curve);

        assertThat(snapshot.getVolatility()).isPositive();
        assertThat(snapshot.getAnnualizedReturnPct()).isPositive();
        assertThat(BigDecimal.valueOf(snapshot.getVolatility()).scale()).isLessThanOrEqualTo(4);
        assertThat(snapshot.getSharpeRatio()).isPositive();
    }

    private Portfolio portfolio(String cash, String totalReturnPercent, Position... positions) {
        BigDecimal marketValue = BigDecimal.ZERO;
        for (Position position : positions) {
            marketValue = marketValue.add(position.getMarketValue());
        }
        BigDecimal balance = new BigDecimal(cash);
        return Portfolio.builder()
                .userId(1L)
                .balance(balance)
                .startingBalance(new BigDecimal("100000"))
                .positions(List.of(positions))
                .totalMarketValue(marketValue)
                .totalUnrealizedPnL(BigDecimal.ZERO)
                .totalEquity(balance.add(marketValue))
                .totalReturn(BigDecimal.ZERO)
                .totalReturnPercent(new BigDecimal(totalReturnPercent))
                .build();
    }

    private Position position(String symbol, String marketValue, String gainPercent) {
        return Position.builder()
                .symbol(symbol)
                .netQuantity(100)
                .avgCost(BigDecimal.ONE)
                .currentPrice(BigDecimal.ONE)
                .marketValue(new BigDecimal(marketValue))
                .unrealizedPnL(BigDecimal.ZERO)
                .gainPercent(new BigDecimal(gainPercent))
                .allocationPercent(BigDecimal.ZERO)
                .build();
    }
}
