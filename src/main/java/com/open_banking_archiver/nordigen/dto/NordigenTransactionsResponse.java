package com.open_banking_archiver.nordigen.dto;

import com.open_banking_archiver.feed.RawTransactionFeed;

/** GET /accounts/{id}/transactions/ */
public record NordigenTransactionsResponse(
        RawTransactionFeed transactions
) {}
