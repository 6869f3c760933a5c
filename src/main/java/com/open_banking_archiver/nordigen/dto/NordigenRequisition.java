package com.open_banking_archiver.nordigen.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

public record NordigenRequisition(
        String id,
        String status,          // "LN" once the end user has linked, "CR", "EX", "RJ", ... otherwise
        String link,
        List<String> accounts,
        @JsonProperty("institution_id") String institutionId,
        String reference,
        String agreement
) {
    public static final String STATUS_LINKED = "LN";

    public boolean isLinked() {
        return STATUS_LINKED.equals(status);
    }

    public List<String> accountIds() {
        return Optional.ofNullable(accounts).orElse(List.of());
    }
}
