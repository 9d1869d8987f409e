package com.simfolio.backend.exception;

public class InsufficientHoldingsException extends TradingException {
    public InsufficientHoldingsException(String message) {
        super(ErrorKind.INSUFFICIENT_HOLDINGS, message);
    }
}
