package com.simfolio.backend.exception;

/**
 * Raised by the market-data client. Callers on the analytics path catch it and degrade
 * (sector "Unknown", position omitted); the trade path turns it into
 * {@link PriceUnavailableException}.
 */
public class MarketDataDegradedException extends TradingException {

    public MarketDataDegradedException(String message) {
        super(ErrorKind.MARKET_DATA_DEGRADED, message);
    }

    public MarketDataDegradedException(String message, Throwable cause) {
        super(ErrorKind.MARKET_DATA_DEGRADED, message, cause);
    }
}
