package com.simfolio.backend.service.ledger;

import com.simfolio.backend.util.MoneyUtils;

import java.math.BigDecimal;

/**
 * Net holding of one symbol after replaying the ledger; only ever built with
 * {@code netQuantity > 0}.
 */
public record ReplayedPosition(String symbol, long netQuantity, BigDecimal totalCost) {

    public BigDecimal avgCost() {
        if (netQuantity <= 0) {
            return BigDecimal.ZERO;
        }
        return totalCost.divide(BigDecimal.valueOf(netQuantity), MoneyUtils.RATIO);
    }
}
