package com.simfolio.backend.exception;

public class MarketDataRateLimitException extends MarketDataDegradedException {
    public MarketDataRateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
