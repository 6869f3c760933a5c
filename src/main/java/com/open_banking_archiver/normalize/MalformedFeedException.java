package com.open_banking_archiver.normalize;

/**
 * A feed record carried an amount or timestamp that could not be parsed.
 */
public class MalformedFeedException extends IllegalArgumentException {

    private final String transactionId;

    public MalformedFeedException(String transactionId, String message, Throwable cause) {
        super("Malformed transaction " + transactionId + ": " + message, cause);
        this.transactionId = transactionId;
    }

    public String getTransactionId() {
        return transactionId;
    }
}
