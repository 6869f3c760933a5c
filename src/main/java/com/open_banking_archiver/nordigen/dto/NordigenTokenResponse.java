package com.open_banking_archiver.nordigen.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** POST /token/new/ and /token/refresh/. The refresh endpoint leaves the refresh fields null. */
public record NordigenTokenResponse(
        String access,
        @JsonProperty("access_expires") long accessExpires,
        String refresh,
        @JsonProperty("refresh_expires") Long refreshExpires
) {}
