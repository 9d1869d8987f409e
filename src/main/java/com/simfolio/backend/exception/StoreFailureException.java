package com.simfolio.backend.exception;

public class StoreFailureException extends TradingException {
    public StoreFailureException(String message, Throwable cause) {
        super(ErrorKind.STORE_FAILURE, message, cause);
    }
}
