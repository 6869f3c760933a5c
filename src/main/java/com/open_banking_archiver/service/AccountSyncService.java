package com.open_banking_archiver.service;

import com.open_banking_archiver.model.Account;
import com.open_banking_archiver.model.Bank;
import com.open_banking_archiver.nordigen.NordigenClient;
import com.open_banking_archiver.nordigen.NordigenTokenManager;
import com.open_banking_archiver.nordigen.dto.NordigenRequisition;
import com.open_banking_archiver.repository.AccountRepository;
import com.open_banking_archiver.repository.BankRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
@Slf4j
@RequiredArgsConstructor
public class AccountSyncService {

    private final NordigenClient nordigenClient;
    private final NordigenTokenManager tokenManager;
    private final BankRepository bankRepository;
    private final AccountRepository accountRepository;

    /**
     * Upserts the accounts of every bank whose requisition is linked.
     *
     * @return number of accounts synced
     */
    public Mono<Long> syncAccounts() {
        return tokenManager.refreshToken()
                .thenMany(bankRepository.findAll().filter(Bank::hasActiveRequisition).collectList())
                .flatMapIterable(banks -> banks)
                .concatMap(bank -> nordigenClient.findRequisition(bank.getActiveRequisitionId())
                        .filter(NordigenRequisition::isLinked)
                        .flatMapMany(requisition -> Flux.fromIterable(requisition.accountIds()))
                        .concatMap(accountId -> syncAccount(bank, accountId)))
                .count()
                .doOnNext(count -> log.info("Synced {} accounts to the database", count));
    }

    /**
     * Fetches one account's details and upserts it under {@code bank}.
     *
     * @return the stored account with its database id
     */
    public Mono<Account> syncAccount(Bank bank, String accountId) {
        return nordigenClient.getAccountDetails(accountId)
                .map(details -> Account.builder()
                        .bankId(bank.getId())
                        .name(details.displayName())
                        .externalId(details.resourceId() != null ? details.resourceId() : accountId)
                        .build())
                .flatMap(accountRepository::upsert);
    }
}
