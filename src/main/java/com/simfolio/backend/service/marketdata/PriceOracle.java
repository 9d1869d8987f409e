package com.simfolio.backend.service.marketdata;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Live market data the ledger needs: a current price and a sector label per symbol.
 */
public interface PriceOracle {

    String UNKNOWN_SECTOR = "Unknown";

    /**
     * @return a strictly positive price, or empty when the provider cannot supply one
     */
    Optional<BigDecimal> getPrice(String symbol);

    /**
     * Never throws; {@link #UNKNOWN_SECTOR} on any failure.
     */
    String getSector(String symbol);
}
