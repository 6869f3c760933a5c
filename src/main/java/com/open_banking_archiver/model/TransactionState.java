package com.open_banking_archiver.model;

import java.util.Arrays;

/**
 * Settlement state reported by the provider feed. Stored in the {@code transaction_state} PG enum.
 */
public enum TransactionState {
    PENDING("pending"),
    BOOKED("booked");

    private final String dbValue;

    TransactionState(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static TransactionState fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(state -> state.dbValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction_state: " + value));
    }
}
