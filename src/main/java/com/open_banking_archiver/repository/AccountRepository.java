package com.open_banking_archiver.repository;

import com.open_banking_archiver.model.Account;
import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@Repository
@RequiredArgsConstructor
public class AccountRepository {

    private final DatabaseClient db;
    private final TransactionalOperator tx;

    public Flux<Account> findAll() {
        log.debug("Retrieving all accounts");
        return db.sql("SELECT id, bank_id, name, external_id FROM accounts ORDER BY id")
                .map(AccountRepository::toAccount)
                .all();
    }

    public Mono<Account> findByExternalId(String externalId) {
        log.debug("Retrieving account with external ID: {}", externalId);
        return db.sql("SELECT id, bank_id, name, external_id FROM accounts WHERE external_id = :externalId")
                .bind("externalId", externalId)
                .map(AccountRepository::toAccount)
                .first();
    }

    /**
     * Idempotent upsert by (bank_id, external_id).
     *
     * @return the stored row, carrying the id to link transactions to
     */
    public Mono<Account> upsert(Account account) {
        log.debug("Upserting account with external ID: {}", account.getExternalId());
        return db.sql("""
                        INSERT INTO accounts (bank_id, external_id, name)
                        VALUES (:bankId, :externalId, :name)
                        ON CONFLICT (bank_id, external_id)
                        DO UPDATE SET name = EXCLUDED.name
                        RETURNING id, bank_id, name, external_id
                        """)
                .bind("bankId", account.getBankId())
                .bind("externalId", account.getExternalId())
                .bind("name", account.getName())
                .map(AccountRepository::toAccount)
                .one()
                .as(tx::transactional);
    }

    static Account toAccount(Readable row) {
        return Account.builder()
                .id(row.get("id", Long.class))
                .bankId(row.get("bank_id", Long.class))
                .name(row.get("name", String.class))
                .externalId(row.get("external_id", String.class))
                .build();
    }
}
