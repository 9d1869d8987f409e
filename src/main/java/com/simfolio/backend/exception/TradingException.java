package com.simfolio.backend.exception;

/**
 * Root of every failure the ledger reports to its callers. The kind decides the HTTP status
 * and the machine-readable error code; the message is shown to the user as-is.
 */
public class TradingException extends RuntimeException {
    private final ErrorKind kind;

    public TradingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TradingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
