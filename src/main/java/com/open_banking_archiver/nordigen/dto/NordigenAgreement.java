package com.open_banking_archiver.nordigen.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NordigenAgreement(
        String id,
        @JsonProperty("institution_id") String institutionId,
        @JsonProperty("max_historical_days") int maxHistoricalDays,
        @JsonProperty("access_valid_for_days") int accessValidForDays
) {}
