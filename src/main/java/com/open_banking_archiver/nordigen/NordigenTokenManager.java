package com.open_banking_archiver.nordigen;

import com.open_banking_archiver.nordigen.dto.NordigenTokenResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process wide access token cache. {@link #refreshToken()} runs before every command or sync cycle.
 * <p>
 * A token is renewed once it is within {@link #EXPIRY_MARGIN} of expiring: through the refresh token while
 * that one is still valid for longer than the margin, with a brand new pair otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NordigenTokenManager {

    static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final NordigenAuthClient authClient;
    private final Clock clock;
    private final AtomicReference<TokenState> state = new AtomicReference<>(TokenState.EMPTY);

    public Mono<Void> refreshToken() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            TokenState current = state.get();

            if (!now.isAfter(current.accessExpiresAt().minus(EXPIRY_MARGIN))) {
                log.debug("Access token still valid.");
                return Mono.empty();
            }

            if (now.isAfter(current.refreshExpiresAt().minus(EXPIRY_MARGIN))) {
                return authClient.newToken()
                        .doOnNext(token -> {
                            state.set(fromNewToken(token, now));
                            log.debug("Refresh token expired. Generated completely new token.");
                        })
                        .then();
            }

            return authClient.refreshAccessToken(current.refreshToken())
                    .doOnNext(token -> {
                        state.set(current.withAccessToken(token.access(), now.plusSeconds(token.accessExpires())));
                        log.debug("Exchanged token using the refresh token.");
                    })
                    .then();
        });
    }

    public String accessToken() {
        String token = state.get().accessToken();
        if (token == null) {
            throw new IllegalStateException("No access token yet, refreshToken() must complete first");
        }
        return token;
    }

    private static TokenState fromNewToken(NordigenTokenResponse token, Instant issuedAt) {
        long refreshExpires = token.refreshExpires() == null ? 0 : token.refreshExpires();
        return new TokenState(
                token.access(),
                issuedAt.plusSeconds(token.accessExpires()),
                token.refresh(),
                issuedAt.plusSeconds(refreshExpires));
    }
}
