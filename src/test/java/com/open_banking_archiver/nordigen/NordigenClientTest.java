package com.open_banking_archiver.nordigen;

import com.open_banking_archiver.feed.RawTransactionFeed;
import com.open_banking_archiver.nordigen.dto.NordigenRequisition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NordigenClientTest {

    private static final String BASE_URL = "https://ob.nordigen.com/api/v2";

    @Mock private NordigenTokenManager tokenManager;

    private final List<ClientRequest> requests = new ArrayList<>();
    private final Map<String, ClientResponse> responses = new HashMap<>();
    private NordigenClient client;

    @BeforeEach
    void setUp() {
        WebClient webClient = WebClient.builder()
                .baseUrl(BASE_URL)
                .exchangeFunction(request -> {
                    requests.add(request);
                    ClientResponse response = responses.get(request.method() + " " + request.url());
                    return Mono.justOrEmpty(response)
                            .switchIfEmpty(Mono.fromSupplier(() -> json(HttpStatus.NOT_FOUND, "{}")));
                })
                .build();
        client = new NordigenClient(webClient, tokenManager);
        when(tokenManager.accessToken()).thenReturn("token-1");
    }

    @Test
    void findRequisition_sendsBearerTokenAndParsesBody() {
        respond(HttpMethod.GET, "/requisitions/req-1/", HttpStatus.OK, """
                {"id": "req-1", "status": "LN", "link": "https://ob.nordigen.com/psd2/start/req-1",
                 "accounts": ["acc-1", "acc-2"], "institution_id": "MONZO_MONZGB2L", "created": "2024-01-01"}
                """);

        StepVerifier.create(client.findRequisition("req-1"))
                .assertNext(requisition -> {
                    assertThat(requisition.isLinked()).isTrue();
                    assertThat(requisition.accountIds()).containsExactly("acc-1", "acc-2");
                    assertThat(requisition.institutionId()).isEqualTo("MONZO_MONZGB2L");
                })
                .verifyComplete();

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer token-1");
    }

    @Test
    void findRequisition_notFound_isEmpty() {
        respond(HttpMethod.GET, "/requisitions/gone/", HttpStatus.NOT_FOUND, "{\"detail\": \"Not found.\"}");

        StepVerifier.create(client.findRequisition("gone")).verifyComplete();
    }

    @Test
    void findRequisition_otherHttpError_propagates() {
        respond(HttpMethod.GET, "/requisitions/req-1/", HttpStatus.TOO_MANY_REQUESTS, "{\"detail\": \"Slow down\"}");

        StepVerifier.create(client.findRequisition("req-1"))
                .expectError(WebClientResponseException.TooManyRequests.class)
                .verify();
    }

    @Test
    void getRequisitions_followsNextLinks() {
        respond(HttpMethod.GET, "/requisitions/", HttpStatus.OK, """
                {"count": 3, "next": "https://ob.nordigen.com/api/v2/requisitions/?limit=2&offset=2", "previous": null,
                 "results": [{"id": "r1", "status": "LN"}, {"id": "r2", "status": "EX"}]}
                """);
        respond(HttpMethod.GET, "/requisitions/?limit=2&offset=2", HttpStatus.OK, """
                {"count": 3, "next": null, "previous": "https://ob.nordigen.com/api/v2/requisitions/?limit=2",
                 "results": [{"id": "r3", "status": "CR"}]}
                """);

        StepVerifier.create(client.getRequisitions().map(NordigenRequisition::id).collectList())
                .assertNext(ids -> assertThat(ids).containsExactly("r1", "r2", "r3"))
                .verifyComplete();
    }

    @Test
    void getTransactions_returnsBothLists() {
        respond(HttpMethod.GET, "/accounts/acc-1/transactions/", HttpStatus.OK, """
                {"transactions": {
                    "booked": [{"transactionId": "b1", "bookingDateTime": "2024-01-01T10:00:00Z",
                                "transactionAmount": {"amount": "-1.00", "currency": "GBP"}}],
                    "pending": []}}
                """);

        StepVerifier.create(client.getTransactions("acc-1"))
                .assertNext(feed -> {
                    assertThat(feed.booked()).hasSize(1);
                    assertThat(feed.booked().get(0).transactionId()).contains("b1");
                    assertThat(feed.pending()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void getTransactions_missingTransactionsObject_isEmptyFeed() {
        respond(HttpMethod.GET, "/accounts/acc-1/transactions/", HttpStatus.OK, "{}");

        StepVerifier.create(client.getTransactions("acc-1"))
                .assertNext(feed -> assertThat(feed).isEqualTo(RawTransactionFeed.empty()))
                .verifyComplete();
    }

    @Test
    void getTransactions_nonObjectEntry_failsDecoding() {
        respond(HttpMethod.GET, "/accounts/acc-1/transactions/", HttpStatus.OK, """
                {"transactions": {"booked": ["not a transaction"], "pending": []}}
                """);

        StepVerifier.create(client.getTransactions("acc-1"))
                .expectError(DecodingException.class)
                .verify();
    }

    @Test
    void getTransactions_nullEntries_areSkipped() {
        respond(HttpMethod.GET, "/accounts/acc-1/transactions/", HttpStatus.OK, """
                {"transactions": {"booked": [null], "pending": [null]}}
                """);

        StepVerifier.create(client.getTransactions("acc-1"))
                .assertNext(feed -> assertThat(feed).isEqualTo(RawTransactionFeed.empty()))
                .verifyComplete();
    }

    @Test
    void getAccountDetails_unwrapsAccount() {
        respond(HttpMethod.GET, "/accounts/acc-1/details/", HttpStatus.OK, """
                {"account": {"resourceId": "res-1", "currency": "GBP", "name": "Main", "details": "Personal Account"}}
                """);

        StepVerifier.create(client.getAccountDetails("acc-1"))
                .assertNext(details -> {
                    assertThat(details.resourceId()).isEqualTo("res-1");
                    assertThat(details.displayName()).isEqualTo("Personal Account");
                })
                .verifyComplete();
    }

    @Test
    void getInstitutions_passesCountryFilter() {
        respond(HttpMethod.GET, "/institutions/?country=GB", HttpStatus.OK, """
                [{"id": "MONZO_MONZGB2L", "name": "Monzo", "bic": "MONZGB2L", "countries": ["GB"]}]
                """);

        StepVerifier.create(client.getInstitutions("GB"))
                .assertNext(institution -> assertThat(institution.name()).isEqualTo("Monzo"))
                .verifyComplete();
    }

    @Test
    void deleteRequisition_completes() {
        respond(HttpMethod.DELETE, "/requisitions/r1/", HttpStatus.OK, "{\"summary\": \"Requisition deleted\"}");

        StepVerifier.create(client.deleteRequisition("r1")).verifyComplete();

        assertThat(requests).extracting(ClientRequest::method).containsExactly(HttpMethod.DELETE);
    }

    private void respond(HttpMethod method, String path, HttpStatus status, String body) {
        responses.put(method + " " + BASE_URL + path, json(status, body));
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
