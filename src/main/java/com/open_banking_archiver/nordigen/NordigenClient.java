package com.open_banking_archiver.nordigen;

import com.open_banking_archiver.feed.RawTransactionFeed;
import com.open_banking_archiver.nordigen.dto.NordigenAccountDetailsResponse;
import com.open_banking_archiver.nordigen.dto.NordigenAgreement;
import com.open_banking_archiver.nordigen.dto.NordigenInstitution;
import com.open_banking_archiver.nordigen.dto.NordigenRequisition;
import com.open_banking_archiver.nordigen.dto.NordigenRequisitionPage;
import com.open_banking_archiver.nordigen.dto.NordigenTransactionsResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authenticated calls against the Nordigen (GoCardless Bank Account Data) v2 API.
 * <p>
 * Callers refresh the token through {@link NordigenTokenManager#refreshToken()} before using this client.
 * HTTP errors propagate as {@link WebClientResponseException}, except a 404 on a single requisition lookup
 * which means the requisition no longer exists.
 */
@Slf4j
@Component
public class NordigenClient {

    private final WebClient nordigenClient;

    public NordigenClient(@Qualifier("nordigenWebClient") WebClient nordigenWebClient,
                          NordigenTokenManager tokenManager) {
        this.nordigenClient = nordigenWebClient.mutate()
                .filter(bearerToken(tokenManager))
                .build();
    }

    public Flux<NordigenInstitution> getInstitutions(String country) {
        return nordigenClient.get()
                .uri(builder -> {
                    builder.path("/institutions/");
                    if (country != null && !country.isBlank()) {
                        builder.queryParam("country", country);
                    }
                    return builder.build();
                })
                .retrieve()
                .bodyToFlux(NordigenInstitution.class);
    }

    public Mono<NordigenAgreement> createAgreement(String institutionId, int maxHistoricalDays,
                                                   int accessValidForDays) {
        Map<String, Object> body = new HashMap<>();
        body.put("institution_id", institutionId);
        body.put("max_historical_days", maxHistoricalDays);
        body.put("access_valid_for_days", accessValidForDays);
        body.put("access_scope", List.of("balances", "details", "transactions"));

        return nordigenClient.post()
                .uri("/agreements/enduser/")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(NordigenAgreement.class);
    }

    public Mono<NordigenRequisition> createRequisition(String redirectUri, String institutionId, String reference,
                                                       String agreementId) {
        Map<String, Object> body = new HashMap<>();
        body.put("redirect", redirectUri);
        body.put("institution_id", institutionId);
        body.put("reference", reference);
        body.put("agreement", agreementId);
        body.put("user_language", "EN");

        return nordigenClient.post()
                .uri("/requisitions/")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(NordigenRequisition.class);
    }

    /**
     * @return the requisition, or empty when the provider answers 404 (deleted or expired and purged)
     */
    public Mono<NordigenRequisition> findRequisition(String requisitionId) {
        return nordigenClient.get()
                .uri("/requisitions/{id}/", requisitionId)
                .retrieve()
                .bodyToMono(NordigenRequisition.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                    log.debug("Requisition {} not found", requisitionId);
                    return Mono.empty();
                });
    }

    /** Every requisition of this secret, following the {@code next} links page by page. */
    public Flux<NordigenRequisition> getRequisitions() {
        return fetchRequisitionPage(null)
                .expand(page -> page.next() == null || page.next().isBlank()
                        ? Mono.empty()
                        : fetchRequisitionPage(page.next()))
                .concatMapIterable(page -> Optional.ofNullable(page.results()).orElse(List.of()));
    }

    public Mono<Void> deleteRequisition(String requisitionId) {
        return nordigenClient.delete()
                .uri("/requisitions/{id}/", requisitionId)
                .retrieve()
                .toBodilessEntity()
                .then();
    }

    public Mono<NordigenAccountDetailsResponse.Details> getAccountDetails(String accountId) {
        return nordigenClient.get()
                .uri("/accounts/{id}/details/", accountId)
                .retrieve()
                .bodyToMono(NordigenAccountDetailsResponse.class)
                .map(NordigenAccountDetailsResponse::account);
    }

    public Mono<RawTransactionFeed> getTransactions(String accountId) {
        return nordigenClient.get()
                .uri("/accounts/{id}/transactions/", accountId)
                .retrieve()
                .bodyToMono(NordigenTransactionsResponse.class)
                .map(res -> Optional.ofNullable(res.transactions()).orElseGet(RawTransactionFeed::empty));
    }

    private Mono<NordigenRequisitionPage> fetchRequisitionPage(String nextUrl) {
        WebClient.RequestHeadersSpec<?> request = nextUrl == null
                ? nordigenClient.get().uri("/requisitions/")
                : nordigenClient.get().uri(URI.create(nextUrl));
        return request
                .retrieve()
                .bodyToMono(NordigenRequisitionPage.class);
    }

    // Resolved per request: the token may have been renewed since the client was built
    private static ExchangeFilterFunction bearerToken(NordigenTokenManager tokenManager) {
        return (request, next) -> Mono.defer(() -> next.exchange(ClientRequest.from(request)
                .headers(headers -> headers.setBearerAuth(tokenManager.accessToken()))
                .build()));
    }
}
