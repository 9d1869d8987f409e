package com.simfolio.backend.service;

import com.simfolio.backend.model.Account;
import com.simfolio.backend.model.LedgerTransaction;
import com.simfolio.backend.model.Portfolio;
import com.simfolio.backend.model.Position;
import com.simfolio.backend.service.ledger.EquityCurveBuilder;
import com.simfolio.backend.service.ledger.EquityPoint;
import com.simfolio.backend.service.ledger.LedgerSnapshot;
import com.simfolio.backend.service.ledger.LedgerStore;
import com.simfolio.backend.service.ledger.PnlPoint;
import com.simfolio.backend.service.ledger.PositionReplayer;
import com.simfolio.backend.service.ledger.ReplayedPosition;
import com.simfolio.backend.service.marketdata.PriceOracle;
import com.simfolio.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Read side of the ledger: positions valued at live prices, and the equity and P&L curves.
 */
@Slf4j
@Service
public class PortfolioService {

    private final LedgerStore ledgerStore;
    private final PositionReplayer positionReplayer;
    private final EquityCurveBuilder equityCurveBuilder;
    private final PriceOracle priceOracle;
    private final Executor marketDataExecutor;

    public PortfolioService(LedgerStore ledgerStore,
                            PositionReplayer positionReplayer,
                            EquityCurveBuilder equityCurveBuilder,
                            PriceOracle priceOracle,
                            @Qualifier("marketDataExecutor") Executor marketDataExecutor) {
        this.ledgerStore = ledgerStore;
        this.positionReplayer = positionReplayer;
        this.equityCurveBuilder = equityCurveBuilder;
        this.priceOracle = priceOracle;
        this.marketDataExecutor = marketDataExecutor;
    }

    public Portfolio getPortfolio(Long userId) {
        LedgerSnapshot snapshot = ledgerStore.readLedger(userId);
        return valuate(snapshot.account(), snapshot.transactions());
    }

    public List<EquityPoint> getEquityCurve(Long userId) {
        LedgerSnapshot snapshot = ledgerStore.readLedger(userId);
        return equityCurveBuilder.build(snapshot.account().getStartingBalance(), snapshot.transactions());
    }

    public List<PnlPoint> getPnlCurve(Long userId) {
        LedgerSnapshot snapshot = ledgerStore.readLedger(userId);
        return equityCurveBuilder.buildPnlCurve(snapshot.account().getStartingBalance(), snapshot.transactions());
    }

    /**
     * Values the replayed positions of {@code transactions}. A symbol without a usable live
     * price is left out of the result; the ledger itself is untouched.
     */
    public Portfolio valuate(Account account, List<LedgerTransaction> transactions) {
        Map<String, ReplayedPosition> replayed = positionReplayer.replay(transactions);
        Map<String, BigDecimal> prices = fetchPrices(replayed.keySet().stream().toList());

        List<Position> priced = new ArrayList<>();
        BigDecimal totalMarketValue = BigDecimal.ZERO;
        for (ReplayedPosition position : replayed.values()) {
            BigDecimal currentPrice = prices.get(position.symbol());
            if (currentPrice == null) {
                log.warn("Unable to fetch valid price for {}, skipping position", position.symbol());
                continue;
            }
            BigDecimal quantity = BigDecimal.valueOf(position.netQuantity());
            BigDecimal avgCost = position.avgCost();
            BigDecimal marketValue = currentPrice.multiply(quantity);
            BigDecimal unrealized = currentPrice.subtract(avgCost).multiply(quantity);
            BigDecimal gainPercent = avgCost.signum() > 0
                    ? MoneyUtils.percentOf(currentPrice.subtract(avgCost), avgCost)
                    : BigDecimal.ZERO;
            totalMarketValue = totalMarketValue.add(marketValue);
            priced.add(Position.builder()
                    .symbol(position.symbol())
                    .netQuantity(position.netQuantity())
                    .avgCost(avgCost)
                    .currentPrice(currentPrice)
                    .marketValue(marketValue)
                    .unrealizedPnL(unrealized)
                    .gainPercent(gainPercent)
                    .build());
        }

        List<Position> positions = new ArrayList<>(priced.size());
        BigDecimal totalUnrealized = BigDecimal.ZERO;
        for (Position position : priced) {
            totalUnrealized = totalUnrealized.add(position.getUnrealizedPnL());
            positions.add(position.toBuilder()
                    .allocationPercent(MoneyUtils.percentOf(position.getMarketValue(), totalMarketValue))
                    .build());
        }

        BigDecimal balance = account.getCashBalance();
        BigDecimal startingBalance = account.getStartingBalance();
        BigDecimal totalEquity = balance.add(totalMarketValue);
        BigDecimal totalReturn = totalEquity.subtract(startingBalance);

        return Portfolio.builder()
                .userId(account.getUserId())
                .balance(balance)
                .startingBalance(startingBalance)
                .positions(List.copyOf(positions))
                .totalMarketValue(totalMarketValue)
                .totalUnrealizedPnL(totalUnrealized)
                .totalEquity(totalEquity)
                .totalReturn(totalReturn)
                .totalReturnPercent(MoneyUtils.percentOf(totalReturn, startingBalance))
                .build();
    }

    private Map<String, BigDecimal> fetchPrices(List<String> symbols) {
        Map<String, CompletableFuture<Optional<BigDecimal>>> pending = new LinkedHashMap<>();
        for (String symbol : symbols) {
            pending.put(symbol, CompletableFuture.supplyAsync(() -> livePrice(symbol), marketDataExecutor));
        }
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        pending.forEach((symbol, future) -> future.join().ifPresent(price -> prices.put(symbol, price)));
        return prices;
    }

    private Optional<BigDecimal> livePrice(String symbol) {
        try {
            return priceOracle.getPrice(symbol).filter(MoneyUtils::isPositive);
        } catch (RuntimeException e) {
            log.warn("Market data degraded for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }
}
