package com.simfolio.backend.exception;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    PRICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    INSUFFICIENT_BALANCE(HttpStatus.UNPROCESSABLE_ENTITY),
    INSUFFICIENT_HOLDINGS(HttpStatus.UNPROCESSABLE_ENTITY),
    ACCOUNT_NOT_FOUND(HttpStatus.NOT_FOUND),
    ACCOUNT_EXISTS(HttpStatus.CONFLICT),
    STORE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE),
    MARKET_DATA_DEGRADED(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
