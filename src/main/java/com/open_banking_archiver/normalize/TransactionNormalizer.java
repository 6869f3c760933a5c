package com.open_banking_archiver.normalize;

import com.open_banking_archiver.feed.RawTransaction;
import com.open_banking_archiver.feed.RawTransactionFeed;
import com.open_banking_archiver.model.Account;
import com.open_banking_archiver.model.Transaction;
import com.open_banking_archiver.model.TransactionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a provider transaction feed into {@link Transaction} rows ready for upsert.
 * <p>
 * The pending list is processed before the booked list. Each list is walked oldest first (the provider
 * sends newest first), and records sharing a booking time get consecutive sequence numbers starting at 1.
 * Numbering restarts for the booked pass. Records without a transaction id are dropped before numbering.
 * <p>
 * The pass order and the reversal decide the sequence numbers stored with each row, so re-syncing the
 * same feed must always yield the same numbers.
 */
@Slf4j
@Component
public class TransactionNormalizer {

    public List<Transaction> normalize(Account account, RawTransactionFeed feed) {
        List<Transaction> results = new ArrayList<>(feed.pending().size() + feed.booked().size());
        appendPass(account, feed.pending(), TransactionState.PENDING, results);
        appendPass(account, feed.booked(), TransactionState.BOOKED, results);
        log.debug("Normalized {} of {} feed records for account {}",
                results.size(), feed.pending().size() + feed.booked().size(), account.getExternalId());
        return results;
    }

    private void appendPass(Account account, List<RawTransaction> records, TransactionState state,
                            List<Transaction> out) {
        // null until the first record of the pass, so that record always starts at 1
        OffsetDateTime currentBookingTime = null;
        int sequenceNumber = 1;

        for (int i = records.size() - 1; i >= 0; i--) {
            RawTransaction raw = records.get(i);
            String id = raw.transactionId().orElse(null);
            if (id == null) {
                continue;
            }

            OffsetDateTime bookingTime = parseBookingTime(id, raw.bookingDateTime());
            if (currentBookingTime != null && bookingTime.isEqual(currentBookingTime)) {
                sequenceNumber++;
            } else {
                sequenceNumber = 1;
                currentBookingTime = bookingTime;
            }

            out.add(toTransaction(account, raw, id, bookingTime, sequenceNumber, state));
        }
    }

    private Transaction toTransaction(Account account, RawTransaction raw, String id, OffsetDateTime bookingTime,
                                      int sequenceNumber, TransactionState state) {
        Transaction.TransactionBuilder builder = Transaction.builder()
                .id(id)
                .accountId(account.getId())
                .bookingTime(bookingTime)
                .sequenceNumber(sequenceNumber)
                .remittanceInfo(raw.remittanceInformation())
                .transactionCode(raw.proprietaryBankTransactionCode().orElse(null))
                .amount(parseAmount(id, "transactionAmount.amount", raw.amount()))
                .currency(raw.currency())
                .state(state)
                .sourceData(raw.sourceData());

        if (raw.hasCurrencyExchange()) {
            builder.sourceCurrency(raw.sourceCurrency().orElse(null))
                    .sourceAmount(raw.instructedAmount()
                            .filter(amount -> !amount.isBlank())
                            .map(amount -> parseAmount(id, "currencyExchange.instructedAmount.amount", amount))
                            .orElse(null))
                    .exchangeRate(raw.exchangeRate()
                            .filter(rate -> !rate.isBlank())
                            .map(rate -> parseRate(id, rate))
                            .orElse(null));
        }
        return builder.build();
    }

    static OffsetDateTime parseBookingTime(String id, String value) {
        if (value == null) {
            throw new MalformedFeedException(id, "bookingDateTime is missing", null);
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value,
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime;
            }
            // No offset in the feed: read as UTC
            return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedFeedException(id, "bookingDateTime '" + value + "' is not ISO-8601", e);
        }
    }

    private static BigDecimal parseAmount(String id, String field, String value) {
        if (value == null) {
            throw new MalformedFeedException(id, field + " is missing", null);
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedFeedException(id, field + " '" + value + "' is not a decimal", e);
        }
    }

    private static Double parseRate(String id, String value) {
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedFeedException(id, "currencyExchange.exchangeRate '" + value + "' is not a number", e);
        }
    }
}
