package com.open_banking_archiver.nordigen;

import com.open_banking_archiver.config.NordigenProperties;
import com.open_banking_archiver.nordigen.dto.NordigenTokenResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Token endpoints. These are the only calls made without a bearer token.
 */
@Component
@RequiredArgsConstructor
public class NordigenAuthClient {

    @Qualifier("nordigenWebClient")
    private final WebClient nordigenClient;
    private final NordigenProperties props;

    public Mono<NordigenTokenResponse> newToken() {
        return nordigenClient.post()
                .uri("/token/new/")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "secret_id", props.getSecretId(),
                        "secret_key", props.getSecretKey()
                ))
                .retrieve()
                .bodyToMono(NordigenTokenResponse.class);
    }

    public Mono<NordigenTokenResponse> refreshAccessToken(String refreshToken) {
        return nordigenClient.post()
                .uri("/token/refresh/")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("refresh", refreshToken))
                .retrieve()
                .bodyToMono(NordigenTokenResponse.class);
    }
}
