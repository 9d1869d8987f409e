package com.simfolio.backend.service.ledger;

import com.simfolio.backend.model.LedgerTransaction;
import com.simfolio.backend.model.TransactionType;
import com.simfolio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds portfolio equity after every transaction from the ledger alone.
 *
 * <p>Holdings are marked at the price of the most recent transaction in that symbol, never at
 * live prices, so the same log always yields the same curve.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EquityCurveBuilder {

    private final Clock clock;

    public List<EquityPoint> build(BigDecimal startingBalance, List<LedgerTransaction> transactions) {
        BigDecimal start = MoneyUtils.scale(startingBalance);
        if (transactions == null || transactions.isEmpty()) {
            return List.of(new EquityPoint(clock.instant(), start));
        }

        BigDecimal cash = start;
        Map<String, Long> holdings = new LinkedHashMap<>();
        Map<String, BigDecimal> lastPrice = new LinkedHashMap<>();
        List<EquityPoint> points = new ArrayList<>();

        for (LedgerTransaction txn : LedgerOrdering.sorted(transactions)) {
            String problem = validate(txn);
            if (problem != null) {
                log.warn("Transaction {} {}, skipping", txn.getId(), problem);
                continue;
            }
            String symbol = txn.getSymbol();
            if (txn.getType() == TransactionType.BUY) {
                cash = MoneyUtils.subtract(cash, txn.getTotalAmount());
                holdings.merge(symbol, (long) txn.getQuantity(), Long::sum);
            } else {
                cash = MoneyUtils.add(cash, txn.getTotalAmount());
                long remaining = holdings.getOrDefault(symbol, 0L) - txn.getQuantity();
                if (remaining <= 0) {
                    holdings.remove(symbol);
                } else {
                    holdings.put(symbol, remaining);
                }
            }
            lastPrice.put(symbol, txn.getPrice());

            BigDecimal holdingsValue = MoneyUtils.ZERO;
            for (Map.Entry<String, Long> holding : holdings.entrySet()) {
                BigDecimal price = lastPrice.getOrDefault(holding.getKey(), BigDecimal.ZERO);
                holdingsValue = MoneyUtils.add(holdingsValue, MoneyUtils.multiply(price, holding.getValue()));
            }
            points.add(new EquityPoint(txn.getCreatedAt(), MoneyUtils.add(cash, holdingsValue)));
        }
        return points;
    }

    public List<PnlPoint> buildPnlCurve(BigDecimal startingBalance, List<LedgerTransaction> transactions) {
        BigDecimal start = MoneyUtils.scale(startingBalance);
        return build(startingBalance, transactions).stream()
                .map(point -> new PnlPoint(point.timestamp(),
                        point.equity().subtract(start).setScale(MoneyUtils.CENTS_SCALE, RoundingMode.HALF_UP)))
                .toList();
    }

    private String validate(LedgerTransaction txn) {
        if (txn.getCreatedAt() == null) {
            return "missing createdAt";
        }
        if (!MoneyUtils.isPositive(txn.getTotalAmount())) {
            return "has invalid totalAmount";
        }
        if (txn.getType() == null) {
            return "has invalid type";
        }
        if (txn.getSymbol() == null || txn.getPrice() == null) {
            return "has no symbol or price";
        }
        return null;
    }
}
