package com.open_banking_archiver.nordigen.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One entry of GET /institutions/ - minimal */
public record NordigenInstitution(
        String id,
        String name,
        String bic,
        @JsonProperty("transaction_total_days") String transactionTotalDays,
        List<String> countries
) {}
