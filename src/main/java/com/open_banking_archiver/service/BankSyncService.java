package com.open_banking_archiver.service;

import com.open_banking_archiver.model.Bank;
import com.open_banking_archiver.model.ProviderType;
import com.open_banking_archiver.nordigen.NordigenClient;
import com.open_banking_archiver.nordigen.NordigenTokenManager;
import com.open_banking_archiver.repository.BankRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@Slf4j
@RequiredArgsConstructor
public class BankSyncService {

    private final NordigenClient nordigenClient;
    private final NordigenTokenManager tokenManager;
    private final BankRepository bankRepository;

    /**
     * Upserts the provider's institutions as banks.
     *
     * @param country ISO 3166 country code to filter on, or null for every institution
     * @return number of banks synced
     */
    public Mono<Integer> syncBanks(String country) {
        log.debug("Retrieving list of banks from Nordigen");
        return tokenManager.refreshToken()
                .thenMany(nordigenClient.getInstitutions(country))
                .map(institution -> Bank.builder()
                        .name(institution.name())
                        .externalId(institution.id())
                        .providerType(ProviderType.OPEN_BANKING)
                        .build())
                .collectList()
                .flatMap(banks -> {
                    log.debug("Retrieved {} banks from Nordigen", banks.size());
                    return bankRepository.upsertAll(banks).thenReturn(banks.size());
                })
                .doOnNext(count -> log.info("Synced {} banks to the database", count));
    }
}
