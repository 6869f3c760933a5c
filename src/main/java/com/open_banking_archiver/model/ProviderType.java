package com.open_banking_archiver.model;

import java.util.Arrays;

/**
 * Aggregation provider a bank is reached through. Stored in the {@code provider_type} PG enum.
 */
public enum ProviderType {
    OPEN_BANKING("open_banking"),
    MONZO("monzo");

    private final String dbValue;

    ProviderType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static ProviderType fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.dbValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider_type: " + value));
    }
}
