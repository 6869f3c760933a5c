package com.open_banking_archiver.repository;

import com.open_banking_archiver.model.Bank;
import com.open_banking_archiver.model.ProviderType;
import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;

@Slf4j
@Repository
@RequiredArgsConstructor
public class BankRepository {

    private static final String COLUMNS =
            "id, name, external_id, provider_type::text AS provider_type, active_requisition_id, activation_email_sent";

    private final DatabaseClient db;
    private final TransactionalOperator tx;

    public Flux<Bank> findAll() {
        log.debug("Retrieving all banks");
        return db.sql("SELECT " + COLUMNS + " FROM banks")
                .map(BankRepository::toBank)
                .all();
    }

    public Mono<Bank> findByName(String name) {
        log.debug("Retrieving bank '{}'", name);
        return db.sql("SELECT " + COLUMNS + " FROM banks WHERE name = :name")
                .bind("name", name)
                .map(BankRepository::toBank)
                .first();
    }

    public Flux<Bank> findAllByIds(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return Flux.empty();
        }
        log.debug("Retrieving banks by IDs: {}", ids);
        return db.sql("SELECT " + COLUMNS + " FROM banks WHERE id IN (:ids)")
                .bind("ids", List.copyOf(ids))
                .map(BankRepository::toBank)
                .all();
    }

    /** Inserts or renames banks keyed by external id. Link state of existing rows is left alone. */
    public Mono<Long> upsertAll(Collection<Bank> banks) {
        log.debug("Upserting {} banks", banks.size());
        return Flux.fromIterable(banks)
                .concatMap(bank -> db.sql("""
                                INSERT INTO banks (name, external_id, provider_type)
                                VALUES (:name, :externalId, CAST(:providerType AS provider_type))
                                ON CONFLICT (external_id) DO UPDATE SET
                                    name          = EXCLUDED.name,
                                    provider_type = EXCLUDED.provider_type
                                """)
                        .bind("name", bank.getName())
                        .bind("externalId", bank.getExternalId())
                        .bind("providerType", bank.getProviderType().dbValue())
                        .fetch()
                        .rowsUpdated())
                .reduce(0L, Long::sum)
                .as(tx::transactional)
                .doOnError(e -> log.error("Failed to upsert {} banks", banks.size(), e));
    }

    public Mono<Void> update(Bank bank) {
        log.debug("Updating bank '{}'", bank.getName());
        var update = db.sql("""
                        UPDATE banks
                           SET name = :name, external_id = :externalId,
                               provider_type = CAST(:providerType AS provider_type),
                               active_requisition_id = :requisitionId, activation_email_sent = :emailSent
                         WHERE id = :id
                        """)
                .bind("id", bank.getId())
                .bind("name", bank.getName())
                .bind("externalId", bank.getExternalId())
                .bind("providerType", bank.getProviderType().dbValue())
                .bind("emailSent", bank.isActivationEmailSent());
        update = bank.hasActiveRequisition()
                ? update.bind("requisitionId", bank.getActiveRequisitionId())
                : update.bindNull("requisitionId", String.class);

        return update.fetch().rowsUpdated()
                .as(tx::transactional)
                .then();
    }

    public Mono<Void> setActivationEmailSent(long bankId, boolean activationEmailSent) {
        log.debug("Updating bank ID {}'s activation_email_sent to {}", bankId, activationEmailSent);
        return db.sql("UPDATE banks SET activation_email_sent = :sent WHERE id = :id")
                .bind("sent", activationEmailSent)
                .bind("id", bankId)
                .fetch()
                .rowsUpdated()
                .as(tx::transactional)
                .then();
    }

    public Mono<Void> clearRequisitionId(String requisitionId) {
        log.debug("Clearing requisition ID '{}'", requisitionId);
        return db.sql("UPDATE banks SET active_requisition_id = NULL WHERE active_requisition_id = :requisitionId")
                .bind("requisitionId", requisitionId)
                .fetch()
                .rowsUpdated()
                .as(tx::transactional)
                .then();
    }

    static Bank toBank(Readable row) {
        return Bank.builder()
                .id(row.get("id", Long.class))
                .name(row.get("name", String.class))
                .externalId(row.get("external_id", String.class))
                .providerType(ProviderType.fromDbValue(row.get("provider_type", String.class)))
                .activeRequisitionId(row.get("active_requisition_id", String.class))
                .activationEmailSent(Boolean.TRUE.equals(row.get("activation_email_sent", Boolean.class)))
                .build();
    }
}
