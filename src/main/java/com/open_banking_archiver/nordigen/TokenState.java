package com.open_banking_archiver.nordigen;

import java.time.Instant;

/**
 * Access/refresh token pair with absolute expiry instants.
 */
record TokenState(String accessToken, Instant accessExpiresAt, String refreshToken, Instant refreshExpiresAt) {

    static final TokenState EMPTY = new TokenState(null, Instant.EPOCH, null, Instant.EPOCH);

    TokenState withAccessToken(String accessToken, Instant accessExpiresAt) {
        return new TokenState(accessToken, accessExpiresAt, refreshToken, refreshExpiresAt);
    }
}
