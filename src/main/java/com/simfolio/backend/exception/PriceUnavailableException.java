package com.simfolio.backend.exception;

public class PriceUnavailableException extends TradingException {
    public PriceUnavailableException(String symbol) {
        super(ErrorKind.PRICE_UNAVAILABLE, "Unable to fetch current price for " + symbol);
    }

    public PriceUnavailableException(String symbol, Throwable cause) {
        super(ErrorKind.PRICE_UNAVAILABLE, "Unable to fetch current price for " + symbol, cause);
    }
}
