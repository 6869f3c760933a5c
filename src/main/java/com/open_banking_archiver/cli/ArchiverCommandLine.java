package com.open_banking_archiver.cli;

import com.open_banking_archiver.config.ArchiverProperties;
import com.open_banking_archiver.dto.SyncSummary;
import com.open_banking_archiver.model.Account;
import com.open_banking_archiver.model.Bank;
import com.open_banking_archiver.repository.AccountRepository;
import com.open_banking_archiver.repository.BankRepository;
import com.open_banking_archiver.service.AccountSyncService;
import com.open_banking_archiver.service.BankNotFoundException;
import com.open_banking_archiver.service.BankSyncService;
import com.open_banking_archiver.service.LinkService;
import com.open_banking_archiver.service.TransactionSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Dispatches the command given on the command line, e.g. {@code sync transactions --poll-interval=3600}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArchiverCommandLine implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: open-banking-archiver [--verbose] [--archiver.log-format=cli|formatted] [--archiver.log-level=LEVEL]"
                    + " COMMAND",
            "",
            "Commands:",
            "  ls banks                                   List known banks",
            "  ls accounts                                List archived accounts",
            "  sync banks [--country=XX]                  Sync the provider's institutions",
            "  sync accounts                              Sync accounts of linked banks",
            "  sync transactions [--poll-interval=SECS]   Archive transactions, repeating every SECS when > 0",
            "  link BANK_NAME                             Create a requisition and print its link",
            "  unlink BANK_NAME                           Forget the bank's requisition",
            "  status BANK_NAME                           Show the bank's link status",
            "  prune                                      Delete stale requisitions");

    private final BankRepository bankRepository;
    private final AccountRepository accountRepository;
    private final BankSyncService bankSyncService;
    private final AccountSyncService accountSyncService;
    private final TransactionSyncService transactionSyncService;
    private final LinkService linkService;
    private final ArchiverProperties props;

    private PrintStream out = System.out;
    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        List<String> command = args.getNonOptionArgs();
        try {
            exitCode = dispatch(command, args);
        } catch (BankNotFoundException e) {
            log.error(e.getMessage());
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    private int dispatch(List<String> command, ApplicationArguments args) {
        String verb = command.isEmpty() ? "" : command.get(0);
        String target = command.size() > 1 ? command.get(1) : null;

        switch (verb) {
            case "ls" -> {
                if ("banks".equals(target)) {
                    listBanks();
                    return EXIT_OK;
                }
                if ("accounts".equals(target)) {
                    listAccounts();
                    return EXIT_OK;
                }
            }
            case "sync" -> {
                if ("banks".equals(target)) {
                    bankSyncService.syncBanks(option(args, "country")).block();
                    return EXIT_OK;
                }
                if ("accounts".equals(target)) {
                    accountSyncService.syncAccounts().block();
                    return EXIT_OK;
                }
                if ("transactions".equals(target)) {
                    return syncTransactions(args);
                }
            }
            case "link" -> {
                if (target != null) {
                    linkService.link(target).block();
                    return EXIT_OK;
                }
            }
            case "unlink" -> {
                if (target != null) {
                    linkService.unlink(target).block();
                    return EXIT_OK;
                }
            }
            case "status" -> {
                if (target != null) {
                    linkService.status(target).block();
                    return EXIT_OK;
                }
            }
            case "prune" -> {
                linkService.prune().block();
                return EXIT_OK;
            }
            default -> {
                // falls through to usage
            }
        }

        if (!verb.isEmpty()) {
            log.error("Unknown command: {}", String.join(" ", command));
        }
        out.println(USAGE);
        return EXIT_USAGE;
    }

    private int syncTransactions(ApplicationArguments args) {
        Duration pollInterval = props.getPollInterval();
        String seconds = option(args, "poll-interval");
        if (seconds != null) {
            try {
                pollInterval = Duration.ofSeconds(Long.parseLong(seconds));
            } catch (NumberFormatException e) {
                log.error("--poll-interval must be a whole number of seconds, got '{}'", seconds);
                return EXIT_USAGE;
            }
        }

        transactionSyncService.sync(pollInterval)
                .doOnNext(this::logSummary)
                .blockLast();
        return EXIT_OK;
    }

    private void listBanks() {
        List<Bank> banks = bankRepository.findAll()
                .sort(Comparator.comparing(Bank::getName))
                .collectList()
                .block();
        out.print(TableFormatter.grid(
                List.of("ID", "Name", "External ID", "Active Requisition ID", "Provider Type"),
                banks.stream()
                        .<List<?>>map(bank -> List.of(
                                bank.getId(),
                                bank.getName(),
                                bank.getExternalId(),
                                bank.hasActiveRequisition() ? bank.getActiveRequisitionId() : "",
                                bank.getProviderType().dbValue()))
                        .toList()));
    }

    private void listAccounts() {
        List<Account> accounts = accountRepository.findAll().collectList().block();
        Map<Long, Bank> banks = bankRepository.findAllByIds(
                        accounts.stream().map(Account::getBankId).collect(Collectors.toSet()))
                .collectMap(Bank::getId, Function.identity())
                .block();
        out.print(TableFormatter.grid(
                List.of("ID", "Name", "External ID", "Bank Name"),
                accounts.stream()
                        .<List<?>>map(account -> {
                            Bank bank = banks.get(account.getBankId());
                            return List.of(
                                    account.getId(),
                                    account.getName(),
                                    account.getExternalId() == null ? "" : account.getExternalId(),
                                    bank != null ? bank.getName() : "Not Found");
                        })
                        .toList()));
    }

    private void logSummary(SyncSummary summary) {
        log.info("Cycle done: {} banks synced, {} skipped, {} reminders sent, {} accounts synced, "
                        + "{} accounts failed, {} transactions archived",
                summary.banksSynced(), summary.banksSkipped(), summary.remindersSent(),
                summary.accountsSynced(), summary.accountsFailed(), summary.transactionsSynced());
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
