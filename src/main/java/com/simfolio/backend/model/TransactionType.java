package com.simfolio.backend.model;

import java.util.Locale;

public enum TransactionType {
    BUY,
    SELL;

    public static TransactionType fromRequest(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        return TransactionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** +1 for BUY, -1 for SELL: the sign a quantity carries in the position replay. */
    public int quantitySign() {
        return this == BUY ? 1 : -1;
    }

    /** -1 for BUY, +1 for SELL: the sign the trade amount carries against cash. */
    public int cashSign() {
        return this == BUY ? -1 : 1;
    }
}
