package com.open_banking_archiver.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    // Provider transactionId, stable across fetches (PRIMARY KEY)
    private String id;

    // FK -> accounts.id
    private Long accountId;

    private OffsetDateTime bookingTime;

    // 1-based tie-breaker among records sharing bookingTime within one feed pass
    private int sequenceNumber;

    private String remittanceInfo;

    private String transactionCode;

    private BigDecimal amount;

    private String currency;

    private BigDecimal sourceAmount;

    private String sourceCurrency;

    private Double exchangeRate;

    private TransactionState state;

    // Raw provider record, kept verbatim (json column)
    private JsonNode sourceData;
}
