package com.simfolio.backend.exception;

public class AccountNotFoundException extends TradingException {
    public AccountNotFoundException(Long userId) {
        super(ErrorKind.ACCOUNT_NOT_FOUND, "Account not found for user " + userId);
    }
}
