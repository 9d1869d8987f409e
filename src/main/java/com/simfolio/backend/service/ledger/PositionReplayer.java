package com.simfolio.backend.service.ledger;

import com.simfolio.backend.model.LedgerTransaction;
import com.simfolio.backend.model.TransactionType;
import com.simfolio.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a user's ledger into open positions using weighted-average cost.
 *
 * <p>A SELL reduces the running cost by the average cost at the time of the sale. When a
 * symbol's quantity reaches zero (or below) its state is dropped, so a later BUY of the same
 * symbol starts a fresh cost basis; lots are not tracked.
 */
@Slf4j
@Component
public class PositionReplayer {

    public Map<String, ReplayedPosition> replay(List<LedgerTransaction> transactions) {
        Map<String, RunningState> states = new LinkedHashMap<>();
        for (LedgerTransaction txn : LedgerOrdering.sorted(transactions)) {
            if (isMalformed(txn)) {
                log.warn("Skipping malformed transaction during position replay: {}", txn.getId());
                continue;
            }
            if (txn.getType() == TransactionType.BUY) {
                RunningState state = states.computeIfAbsent(txn.getSymbol(), key -> new RunningState());
                state.quantity += txn.getQuantity();
                state.totalCost = state.totalCost.add(txn.getTotalAmount());
            } else {
                RunningState state = states.get(txn.getSymbol());
                if (state == null) {
                    continue;
                }
                BigDecimal avgCostBeforeSell = state.quantity > 0
                        ? state.totalCost.divide(BigDecimal.valueOf(state.quantity), MoneyUtils.RATIO)
                        : BigDecimal.ZERO;
                state.totalCost = state.totalCost.subtract(avgCostBeforeSell.multiply(BigDecimal.valueOf(txn.getQuantity())));
                state.quantity -= txn.getQuantity();
                if (state.quantity <= 0) {
                    states.remove(txn.getSymbol());
                }
            }
        }

        Map<String, ReplayedPosition> positions = new LinkedHashMap<>();
        states.forEach((symbol, state) -> {
            if (state.quantity > 0) {
                positions.put(symbol, new ReplayedPosition(symbol, state.quantity, state.totalCost));
            }
        });
        return Collections.unmodifiableMap(positions);
    }

    /**
     * Signed quantity sum (BUY positive, SELL negative) for one symbol, with no reset on a
     * full close. Used to validate a SELL against what the ledger says is held.
     */
    public long netQuantity(List<LedgerTransaction> transactions, String symbol) {
        long net = 0;
        for (LedgerTransaction txn : transactions) {
            if (isMalformed(txn) || !txn.getSymbol().equals(symbol)) {
                continue;
            }
            net += (long) txn.getType().quantitySign() * txn.getQuantity();
        }
        return net;
    }

    private boolean isMalformed(LedgerTransaction txn) {
        return txn.getType() == null
                || txn.getSymbol() == null
                || txn.getQuantity() <= 0
                || txn.getTotalAmount() == null;
    }

    private static final class RunningState {
        private long quantity;
        private BigDecimal totalCost = BigDecimal.ZERO;
    }
}
