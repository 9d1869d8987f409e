package com.simfolio.backend.exception;

public class InvalidInputException extends TradingException {
    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }
}
