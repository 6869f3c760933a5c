package com.open_banking_archiver.dto;

import lombok.Builder;

import java.util.List;

/**
 * Outcome of one transaction sync cycle over every linked bank.
 */
@Builder
public record SyncSummary(
        int banksSynced,
        int banksSkipped,
        int remindersSent,
        int accountsSynced,
        int accountsFailed,
        int transactionsSynced,
        List<BankResult> bankResults
) {
    public enum Outcome {
        SYNCED,           // requisition linked, accounts processed
        REMINDER_SENT,    // requisition not linked, reminder emailed this cycle
        AWAITING_LINK,    // requisition not linked, reminder already sent earlier (or sending failed)
        LINK_MISSING      // requisition gone on the provider side, id cleared
    }

    @Builder
    public record BankResult(
            String bankName,
            Outcome outcome,
            List<AccountResult> accountResults
    ) {}

    public record AccountResult(
            String accountId,
            boolean failed,
            int transactionsSynced
    ) {
        public static AccountResult synced(String accountId, int transactions) {
            return new AccountResult(accountId, false, transactions);
        }

        public static AccountResult failed(String accountId) {
            return new AccountResult(accountId, true, 0);
        }
    }

    public static SyncSummary of(List<BankResult> results) {
        List<AccountResult> accounts = results.stream()
                .flatMap(r -> r.accountResults().stream())
                .toList();
        return SyncSummary.builder()
                .banksSynced((int) results.stream().filter(r -> r.outcome() == Outcome.SYNCED).count())
                .banksSkipped((int) results.stream().filter(r -> r.outcome() != Outcome.SYNCED).count())
                .remindersSent((int) results.stream().filter(r -> r.outcome() == Outcome.REMINDER_SENT).count())
                .accountsSynced((int) accounts.stream().filter(a -> !a.failed()).count())
                .accountsFailed((int) accounts.stream().filter(AccountResult::failed).count())
                .transactionsSynced(accounts.stream().mapToInt(AccountResult::transactionsSynced).sum())
                .bankResults(results)
                .build();
    }
}
