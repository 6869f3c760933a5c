package com.open_banking_archiver.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * The {@code transactions} object of an account transactions response. Both lists are newest first.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawTransactionFeed(
        List<RawTransaction> booked,
        List<RawTransaction> pending
) {
    public RawTransactionFeed {
        booked = withoutNulls(booked);
        pending = withoutNulls(pending);
    }

    public static RawTransactionFeed empty() {
        return new RawTransactionFeed(List.of(), List.of());
    }

    // A missing list, or null entries in it, carry no transaction
    private static List<RawTransaction> withoutNulls(List<RawTransaction> records) {
        return records == null ? List.of() : records.stream().filter(Objects::nonNull).toList();
    }
}
