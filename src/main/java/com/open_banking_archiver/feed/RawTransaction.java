package com.open_banking_archiver.feed;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * One record of the provider's transaction feed, kept as the JSON object it arrived as.
 * <p>
 * Accessors only pick fields out of the node; parsing amounts and timestamps is left to the normalizer.
 */
public record RawTransaction(ObjectNode node) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public RawTransaction {
        Objects.requireNonNull(node, "node");
    }

    public Optional<String> transactionId() {
        return text(node, "transactionId").filter(id -> !id.isBlank());
    }

    public String bookingDateTime() {
        return text(node, "bookingDateTime").orElse(null);
    }

    public String amount() {
        return text(node.path("transactionAmount"), "amount").orElse(null);
    }

    public String currency() {
        return text(node.path("transactionAmount"), "currency").orElse(null);
    }

    public boolean hasCurrencyExchange() {
        return node.path("currencyExchange").isObject();
    }

    public Optional<String> sourceCurrency() {
        return text(node.path("currencyExchange"), "sourceCurrency");
    }

    public Optional<String> instructedAmount() {
        return text(node.path("currencyExchange").path("instructedAmount"), "amount");
    }

    public Optional<String> exchangeRate() {
        return text(node.path("currencyExchange"), "exchangeRate");
    }

    /**
     * Unstructured remittance text. Some banks only send the array form, whose lines are joined with a space.
     */
    public String remittanceInformation() {
        Optional<String> single = text(node, "remittanceInformationUnstructured");
        if (single.isPresent()) {
            return single.get();
        }
        JsonNode lines = node.path("remittanceInformationUnstructuredArray");
        if (lines.isArray()) {
            return StreamSupport.stream(lines.spliterator(), false)
                    .map(JsonNode::asText)
                    .collect(Collectors.joining(" "));
        }
        return "";
    }

    public Optional<String> proprietaryBankTransactionCode() {
        return text(node, "proprietaryBankTransactionCode");
    }

    @JsonValue
    public ObjectNode sourceData() {
        return node;
    }

    private static Optional<String> text(JsonNode parent, String field) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(value.isTextual() ? value.textValue() : value.asText());
    }
}
