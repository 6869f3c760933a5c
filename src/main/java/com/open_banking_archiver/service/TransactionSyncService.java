package com.open_banking_archiver.service;

import com.open_banking_archiver.config.ArchiverProperties;
import com.open_banking_archiver.dto.SyncSummary;
import com.open_banking_archiver.dto.SyncSummary.AccountResult;
import com.open_banking_archiver.dto.SyncSummary.BankResult;
import com.open_banking_archiver.dto.SyncSummary.Outcome;
import com.open_banking_archiver.model.Bank;
import com.open_banking_archiver.normalize.MalformedFeedException;
import com.open_banking_archiver.normalize.TransactionNormalizer;
import com.open_banking_archiver.nordigen.NordigenClient;
import com.open_banking_archiver.nordigen.NordigenTokenManager;
import com.open_banking_archiver.nordigen.dto.NordigenRequisition;
import com.open_banking_archiver.repository.BankRepository;
import com.open_banking_archiver.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Pulls the transaction feed of every linked account into the archive.
 * <p>
 * Banks and accounts are processed one at a time. A bank whose requisition is not linked gets one reminder
 * email per unlinked episode and is skipped. A malformed or undecodable feed, or a failed batch write, only
 * skips that account; provider HTTP errors abort the cycle.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TransactionSyncService {

    private final NordigenClient nordigenClient;
    private final NordigenTokenManager tokenManager;
    private final BankRepository bankRepository;
    private final TransactionRepository transactionRepository;
    private final AccountSyncService accountSyncService;
    private final TransactionNormalizer normalizer;
    private final LinkEmailService emailService;
    private final ArchiverProperties props;

    /**
     * Runs one cycle, or, for a positive interval, a cycle every {@code pollInterval} until cancelled.
     */
    public Flux<SyncSummary> sync(Duration pollInterval) {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            return runCycle().flux();
        }
        return Mono.defer(this::runCycle)
                .repeatWhen(completions -> completions
                        .doOnNext(n -> log.debug("Sleeping for {} seconds", pollInterval.toSeconds()))
                        .delayElements(pollInterval));
    }

    public Mono<SyncSummary> runCycle() {
        return tokenManager.refreshToken()
                .thenMany(bankRepository.findAll().filter(Bank::hasActiveRequisition).collectList())
                .flatMapIterable(banks -> banks)
                .concatMap(this::syncBank)
                .collectList()
                .map(SyncSummary::of)
                .doOnNext(summary -> log.debug("Sync cycle finished: {} banks synced, {} skipped, {} transactions",
                        summary.banksSynced(), summary.banksSkipped(), summary.transactionsSynced()));
    }

    Mono<BankResult> syncBank(Bank bank) {
        return nordigenClient.findRequisition(bank.getActiveRequisitionId())
                .flatMap(requisition -> requisition.isLinked()
                        ? syncLinkedBank(bank, requisition)
                        : remindUnlinkedBank(bank, requisition))
                .switchIfEmpty(Mono.defer(() -> forgetMissingRequisition(bank)));
    }

    private Mono<BankResult> syncLinkedBank(Bank bank, NordigenRequisition requisition) {
        // Linked again: the next time it lapses deserves a fresh reminder
        return bankRepository.setActivationEmailSent(bank.getId(), false)
                .thenMany(Flux.fromIterable(requisition.accountIds()))
                .concatMap(accountId -> syncAccountTransactions(bank, accountId))
                .collectList()
                .map(accounts -> result(bank, Outcome.SYNCED, accounts));
    }

    private Mono<AccountResult> syncAccountTransactions(Bank bank, String accountId) {
        return accountSyncService.syncAccount(bank, accountId)
                .flatMap(account -> {
                    log.debug("Requesting transactions for account ID {}", accountId);
                    return nordigenClient.getTransactions(accountId)
                            .map(feed -> normalizer.normalize(account, feed))
                            .flatMap(transactions -> transactionRepository.upsertAll(transactions)
                                    .doOnSuccess(n -> log.info(
                                            "Synced {} transactions of {} account at {} to the database",
                                            transactions.size(), account.getName(), bank.getName()))
                                    .thenReturn(AccountResult.synced(accountId, transactions.size())));
                })
                .onErrorResume(TransactionSyncService::isAccountScoped, e -> {
                    log.error("Skipping account {} at {} for this cycle: {}", accountId, bank.getName(),
                            e.getMessage(), e);
                    return Mono.just(AccountResult.failed(accountId));
                });
    }

    private Mono<BankResult> remindUnlinkedBank(Bank bank, NordigenRequisition requisition) {
        if (bank.isActivationEmailSent()) {
            log.debug("Link with {} is {}, reminder already sent", bank.getName(), requisition.status());
            return Mono.just(result(bank, Outcome.AWAITING_LINK, List.of()));
        }

        log.warn("Link with {} is {}, sending a reminder to reactivate it", bank.getName(), requisition.status());
        // Flagged whether or not the send went through: one attempt per unlinked episode
        return emailService.sendLink(props.getUserEmail(), bank, requisition.link())
                .flatMap(sent -> bankRepository.setActivationEmailSent(bank.getId(), true)
                        .thenReturn(result(bank, sent ? Outcome.REMINDER_SENT : Outcome.AWAITING_LINK, List.of())));
    }

    private Mono<BankResult> forgetMissingRequisition(Bank bank) {
        log.warn("Requisition {} of {} no longer exists, clearing it. Run `link '{}'` to create a new one.",
                bank.getActiveRequisitionId(), bank.getName(), bank.getName());
        return bankRepository.clearRequisitionId(bank.getActiveRequisitionId())
                .thenReturn(result(bank, Outcome.LINK_MISSING, List.of()));
    }

    private static boolean isAccountScoped(Throwable e) {
        // DecodingException: the feed body does not have the expected shape
        return e instanceof MalformedFeedException || e instanceof DecodingException
                || e instanceof DataAccessException;
    }

    private static BankResult result(Bank bank, Outcome outcome, List<AccountResult> accounts) {
        return BankResult.builder()
                .bankName(bank.getName())
                .outcome(outcome)
                .accountResults(accounts)
                .build();
    }
}
