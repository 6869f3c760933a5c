package com.open_banking_archiver.dto;

/**
 * Result of {@code link <bank>}.
 */
public record LinkOutcome(Kind kind, String requisitionId, String link) {

    public enum Kind {
        ALREADY_ACTIVE,
        NEEDS_UNLINK,
        CREATED
    }
}
