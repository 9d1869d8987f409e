package com.simfolio.backend.exception;

public class AccountAlreadyExistsException extends TradingException {
    public AccountAlreadyExistsException(String message) {
        super(ErrorKind.ACCOUNT_EXISTS, message);
    }
}
