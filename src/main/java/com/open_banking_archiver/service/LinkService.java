package com.open_banking_archiver.service;

import com.open_banking_archiver.config.ArchiverProperties;
import com.open_banking_archiver.dto.LinkOutcome;
import com.open_banking_archiver.dto.PruneResult;
import com.open_banking_archiver.model.Bank;
import com.open_banking_archiver.nordigen.NordigenClient;
import com.open_banking_archiver.nordigen.NordigenTokenManager;
import com.open_banking_archiver.nordigen.dto.NordigenRequisition;
import com.open_banking_archiver.repository.BankRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Requisition housekeeping behind the {@code link}, {@code unlink}, {@code status} and {@code prune} commands.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LinkService {

    static final String ACTIVE = "ACTIVE";
    static final String INACTIVE = "INACTIVE";

    private final NordigenClient nordigenClient;
    private final NordigenTokenManager tokenManager;
    private final BankRepository bankRepository;
    private final ArchiverProperties props;

    public Mono<LinkOutcome> link(String bankName) {
        return findBank(bankName)
                .flatMap(bank -> tokenManager.refreshToken()
                        .then(currentRequisition(bank))
                        .map(requisition -> existingLink(bank, requisition))
                        .switchIfEmpty(Mono.defer(() -> createLink(bank))));
    }

    /**
     * @return true if a requisition existed and was detached from the bank
     */
    public Mono<Boolean> unlink(String bankName) {
        return findBank(bankName)
                .flatMap(bank -> tokenManager.refreshToken()
                        .then(currentRequisition(bank))
                        .flatMap(requisition -> bankRepository.update(bank.toBuilder()
                                        .activeRequisitionId(null)
                                        .build())
                                .doOnSuccess(v -> log.info("Link with {} exists and has been removed.", bankName))
                                .thenReturn(true))
                        .switchIfEmpty(Mono.fromSupplier(() -> {
                            log.info("No link currently exists with {}", bankName);
                            return false;
                        })));
    }

    /**
     * @return {@code ACTIVE} when linked, the provider status for any other live requisition,
     * {@code INACTIVE} when there is none
     */
    public Mono<String> status(String bankName) {
        return findBank(bankName)
                .flatMap(bank -> {
                    if (!bank.hasActiveRequisition()) {
                        return Mono.just(INACTIVE);
                    }
                    return tokenManager.refreshToken()
                            .then(currentRequisition(bank))
                            .map(requisition -> requisition.isLinked() ? ACTIVE : requisition.status())
                            .defaultIfEmpty(INACTIVE);
                })
                .doOnNext(status -> log.info("Link with {}: {}", bankName, status));
    }

    /**
     * Deletes provider requisitions that are not linked or not tracked by any bank, then clears tracked ids
     * the provider no longer knows.
     */
    public Mono<PruneResult> prune() {
        Mono<Set<String>> trackedIds = bankRepository.findAll()
                .filter(Bank::hasActiveRequisition)
                .map(Bank::getActiveRequisitionId)
                .collect(Collectors.toSet());

        return trackedIds.flatMap(tracked -> tokenManager.refreshToken()
                .thenMany(nordigenClient.getRequisitions())
                .collectList()
                .flatMap(requisitions -> {
                    Set<String> remoteIds = requisitions.stream()
                            .map(NordigenRequisition::id)
                            .collect(Collectors.toSet());

                    Mono<List<String>> deleted = Flux.fromIterable(requisitions)
                            .filter(r -> !r.isLinked() || !tracked.contains(r.id()))
                            .concatMap(r -> {
                                log.info("Deleting requisition ID {}", r.id());
                                return nordigenClient.deleteRequisition(r.id()).thenReturn(r.id());
                            })
                            .collectList();

                    Set<String> orphans = new HashSet<>(tracked);
                    orphans.removeAll(remoteIds);
                    Mono<List<String>> cleared = Flux.fromIterable(orphans)
                            .concatMap(id -> {
                                log.info("Clearing orphaned requisition ID {}", id);
                                return bankRepository.clearRequisitionId(id).thenReturn(id);
                            })
                            .collectList();

                    return deleted.zipWith(cleared, PruneResult::new);
                }));
    }

    private LinkOutcome existingLink(Bank bank, NordigenRequisition requisition) {
        if (requisition.isLinked()) {
            log.info("Link with {} already active. Link: {}", bank.getName(), requisition.link());
            return new LinkOutcome(LinkOutcome.Kind.ALREADY_ACTIVE, requisition.id(), requisition.link());
        }
        log.info("Link with {} exists but is not active. Unlink it first using `unlink '{}'`",
                bank.getName(), bank.getName());
        return new LinkOutcome(LinkOutcome.Kind.NEEDS_UNLINK, requisition.id(), requisition.link());
    }

    private Mono<LinkOutcome> createLink(Bank bank) {
        return nordigenClient.createAgreement(bank.getExternalId(), props.getMaxHistoricalDays(),
                        props.getAccessValidForDays())
                .flatMap(agreement -> nordigenClient.createRequisition(props.getRedirectUri(), bank.getExternalId(),
                        UUID.randomUUID().toString(), agreement.id()))
                .flatMap(requisition -> bankRepository.update(bank.toBuilder()
                                .activeRequisitionId(requisition.id())
                                .activationEmailSent(false)
                                .build())
                        .doOnSuccess(v -> log.info("Link: {}", requisition.link()))
                        .thenReturn(new LinkOutcome(LinkOutcome.Kind.CREATED, requisition.id(), requisition.link())));
    }

    private Mono<NordigenRequisition> currentRequisition(Bank bank) {
        return bank.hasActiveRequisition()
                ? nordigenClient.findRequisition(bank.getActiveRequisitionId())
                : Mono.empty();
    }

    private Mono<Bank> findBank(String bankName) {
        return bankRepository.findByName(bankName)
                .switchIfEmpty(Mono.error(() -> new BankNotFoundException(bankName)));
    }
}
