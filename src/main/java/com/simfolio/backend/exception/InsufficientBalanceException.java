package com.simfolio.backend.exception;

public class InsufficientBalanceException extends TradingException {
    public InsufficientBalanceException(String message) {
        super(ErrorKind.INSUFFICIENT_BALANCE, message);
    }
}
