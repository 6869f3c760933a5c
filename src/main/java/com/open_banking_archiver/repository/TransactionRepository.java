package com.open_banking_archiver.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.open_banking_archiver.model.Transaction;
import com.open_banking_archiver.model.TransactionState;
import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Collection;

/**
 * Archive of normalized transactions, keyed by the provider transaction id.
 * <p>
 * Upserts overwrite every column of an existing row, so a pending transaction that later books keeps its row.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class TransactionRepository {

    private static final String UPSERT = """
            INSERT INTO transactions (id, account_id, booking_time, sequence_number, remittance_info,
                                      transaction_code, currency, source_currency, source_amount, amount,
                                      exchange_rate, source_data, state)
            VALUES (:id, :accountId, :bookingTime, :sequenceNumber, :remittanceInfo,
                    :transactionCode, :currency, :sourceCurrency, :sourceAmount, :amount,
                    :exchangeRate, CAST(:sourceData AS json), CAST(:state AS transaction_state))
            ON CONFLICT (id) DO UPDATE SET
                account_id       = EXCLUDED.account_id,
                booking_time     = EXCLUDED.booking_time,
                sequence_number  = EXCLUDED.sequence_number,
                remittance_info  = EXCLUDED.remittance_info,
                transaction_code = EXCLUDED.transaction_code,
                currency         = EXCLUDED.currency,
                source_currency  = EXCLUDED.source_currency,
                source_amount    = EXCLUDED.source_amount,
                amount           = EXCLUDED.amount,
                exchange_rate    = EXCLUDED.exchange_rate,
                source_data      = EXCLUDED.source_data,
                state            = EXCLUDED.state
            """;

    private static final String SELECT = """
            SELECT id, account_id, booking_time, sequence_number, remittance_info, transaction_code, currency,
                   source_currency, source_amount, amount, exchange_rate, source_data::text AS source_data,
                   state::text AS state
              FROM transactions
            """;

    private final DatabaseClient db;
    private final TransactionalOperator tx;
    private final ObjectMapper objectMapper;

    public Mono<Void> upsert(Transaction transaction) {
        return execute(transaction)
                .as(tx::transactional)
                .then();
    }

    /**
     * Upserts the whole batch in one database transaction. Any failure rolls back every row of the batch
     * and is re-raised to the caller.
     *
     * @return number of rows written
     */
    public Mono<Long> upsertAll(Collection<Transaction> transactions) {
        log.debug("Upserting {} transactions", transactions.size());
        return Flux.fromIterable(transactions)
                .concatMap(this::execute)
                .reduce(0L, Long::sum)
                .as(tx::transactional)
                .doOnError(e -> log.error(
                        "An error occurred while inserting {} transactions of account ID {} into the database",
                        transactions.size(),
                        transactions.stream().findFirst().map(Transaction::getAccountId).orElse(null), e));
    }

    public Flux<Transaction> findByAccountId(long accountId) {
        return db.sql(SELECT + " WHERE account_id = :accountId ORDER BY booking_time, state, sequence_number")
                .bind("accountId", accountId)
                .map(this::toTransaction)
                .all();
    }

    public Mono<Transaction> findById(String id) {
        return db.sql(SELECT + " WHERE id = :id")
                .bind("id", id)
                .map(this::toTransaction)
                .first();
    }

    private Mono<Long> execute(Transaction t) {
        var insert = db.sql(UPSERT)
                .bind("id", t.getId())
                .bind("accountId", t.getAccountId())
                .bind("bookingTime", t.getBookingTime())
                .bind("sequenceNumber", t.getSequenceNumber())
                .bind("remittanceInfo", t.getRemittanceInfo())
                .bind("amount", t.getAmount())
                .bind("sourceData", writeJson(t.getSourceData()))
                .bind("state", t.getState().dbValue());

        insert = bindNullable(insert, "transactionCode", t.getTransactionCode(), String.class);
        insert = bindNullable(insert, "currency", t.getCurrency(), String.class);
        insert = bindNullable(insert, "sourceCurrency", t.getSourceCurrency(), String.class);
        insert = bindNullable(insert, "sourceAmount", t.getSourceAmount(), BigDecimal.class);
        insert = bindNullable(insert, "exchangeRate", t.getExchangeRate(), Double.class);

        return insert.fetch().rowsUpdated();
    }

    private static <T> DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec insert,
                                                                      String name, T value, Class<T> type) {
        return value != null ? insert.bind(name, value) : insert.bindNull(name, type);
    }

    private Transaction toTransaction(Readable row) {
        String sourceData = row.get("source_data", String.class);
        return Transaction.builder()
                .id(row.get("id", String.class))
                .accountId(row.get("account_id", Long.class))
                .bookingTime(row.get("booking_time", OffsetDateTime.class))
                .sequenceNumber(row.get("sequence_number", Integer.class))
                .remittanceInfo(row.get("remittance_info", String.class))
                .transactionCode(row.get("transaction_code", String.class))
                .currency(row.get("currency", String.class))
                .sourceCurrency(row.get("source_currency", String.class))
                .sourceAmount(row.get("source_amount", BigDecimal.class))
                .amount(row.get("amount", BigDecimal.class))
                .exchangeRate(row.get("exchange_rate", Double.class))
                .sourceData(sourceData == null ? null : readJson(sourceData))
                .state(TransactionState.fromDbValue(row.get("state", String.class)))
                .build();
    }

    private String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private JsonNode readJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
