package com.open_banking_archiver.normalize;

import com.open_banking_archiver.feed.RawTransaction;
import com.open_banking_archiver.feed.RawTransactionFeed;
import com.open_banking_archiver.model.Account;
import com.open_banking_archiver.model.Transaction;
import com.open_banking_archiver.model.TransactionState;
import com.open_banking_archiver.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

import static com.open_banking_archiver.testutil.TestDataFactory.feed;
import static com.open_banking_archiver.testutil.TestDataFactory.rawTransaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class TransactionNormalizerTest {

    private final TransactionNormalizer normalizer = new TransactionNormalizer();
    private final Account account = TestDataFactory.createAccount(7, 1, "acc-1");

    @Test
    void normalize_sameTimestampInBookedList_numbersOldestFirst() {
        RawTransactionFeed feed = feed(List.of(
                rawTransaction("b2", "2024-01-01T10:00:00Z", "5.00"),
                rawTransaction("b1", "2024-01-01T10:00:00Z", "3.00")
        ), List.of());

        List<Transaction> result = normalizer.normalize(account, feed);

        assertThat(result)
                .extracting(Transaction::getId, Transaction::getSequenceNumber, Transaction::getState)
                .containsExactly(
                        tuple("b1", 1, TransactionState.BOOKED),
                        tuple("b2", 2, TransactionState.BOOKED));
        assertThat(result).allSatisfy(t -> assertThat(t.getAccountId()).isEqualTo(7L));
    }

    @Test
    void normalize_timestampChange_resetsSequence() {
        RawTransactionFeed feed = feed(List.of(
                rawTransaction("t5", "2024-01-02T09:00:00Z", "1.00"),
                rawTransaction("t4", "2024-01-01T10:00:00Z", "1.00"),
                rawTransaction("t3", "2024-01-01T10:00:00Z", "1.00"),
                rawTransaction("t2", "2024-01-01T10:00:00Z", "1.00"),
                rawTransaction("t1", "2024-01-01T08:00:00Z", "1.00")
        ), List.of());

        assertThat(normalizer.normalize(account, feed))
                .extracting(Transaction::getId, Transaction::getSequenceNumber)
                .containsExactly(
                        tuple("t1", 1),
                        tuple("t2", 1),
                        tuple("t3", 2),
                        tuple("t4", 3),
                        tuple("t5", 1));
    }

    @Test
    void normalize_sameTimestampNotAdjacent_startsAgainAtOne() {
        RawTransactionFeed feed = feed(List.of(
                rawTransaction("c", "2024-01-01T10:00:00Z", "1.00"),
                rawTransaction("b", "2024-01-01T11:00:00Z", "1.00"),
                rawTransaction("a", "2024-01-01T10:00:00Z", "1.00")
        ), List.of());

        assertThat(normalizer.normalize(account, feed))
                .extracting(Transaction::getId, Transaction::getSequenceNumber)
                .containsExactly(tuple("a", 1), tuple("b", 1), tuple("c", 1));
    }

    @Test
    void normalize_pendingPassComesFirst_andBookedNumberingStartsFresh() {
        RawTransactionFeed feed = feed(
                List.of(rawTransaction("b1", "2024-01-01T10:00:00Z", "1.00")),
                List.of(
                        rawTransaction("p2", "2024-01-01T10:00:00Z", "1.00"),
                        rawTransaction("p1", "2024-01-01T10:00:00Z", "1.00")));

        assertThat(normalizer.normalize(account, feed))
                .extracting(Transaction::getId, Transaction::getSequenceNumber, Transaction::getState)
                .containsExactly(
                        tuple("p1", 1, TransactionState.PENDING),
                        tuple("p2", 2, TransactionState.PENDING),
                        // same instant as the last pending record, still 1
                        tuple("b1", 1, TransactionState.BOOKED));
    }

    @Test
    void normalize_recordWithoutId_isDroppedAndDoesNotCount() {
        RawTransactionFeed feed = feed(List.of(
                rawTransaction("b2", "2024-01-01T10:00:00Z", "1.00"),
                rawTransaction(null, "2024-01-01T10:00:00Z", "1.00"),
                rawTransaction("b1", "2024-01-01T10:00:00Z", "1.00")
        ), List.of());

        assertThat(normalizer.normalize(account, feed))
                .extracting(Transaction::getId, Transaction::getSequenceNumber)
                .containsExactly(tuple("b1", 1), tuple("b2", 2));
    }

    @Test
    void normalize_blankOrNullId_isDropped() {
        RawTransactionFeed feed = feed(List.of(
                rawTransaction("{\"transactionId\": \"\", \"bookingDateTime\": \"2024-01-01T10:00:00Z\"}"),
                rawTransaction("{\"transactionId\": null, \"bookingDateTime\": \"2024-01-01T10:00:00Z\"}")
        ), List.of());

        assertThat(normalizer.normalize(account, feed)).isEmpty();
    }

    @Test
    void normalize_emptyFeed_yieldsNothing() {
        assertThat(normalizer.normalize(account, RawTransactionFeed.empty())).isEmpty();
        assertThat(normalizer.normalize(account, new RawTransactionFeed(null, null))).isEmpty();
    }

    @Test
    void normalize_sameInstantWithDifferentOffsets_countsAsSameTime() {
        RawTransactionFeed feed = feed(List.of(
                rawTransaction("b2", "2024-01-01T11:00:00+01:00", "1.00"),
                rawTransaction("b1", "2024-01-01T10:00:00Z", "1.00")
        ), List.of());

        assertThat(normalizer.normalize(account, feed))
                .extracting(Transaction::getSequenceNumber)
                .containsExactly(1, 2);
    }

    @Test
    void normalize_timestampWithoutOffset_isReadAsUtc() {
        RawTransactionFeed feed = feed(List.of(rawTransaction("b1", "2024-01-01T10:00:00", "1.00")), List.of());

        Transaction result = normalizer.normalize(account, feed).get(0);

        assertThat(result.getBookingTime()).isEqualTo(OffsetDateTime.parse("2024-01-01T10:00:00Z"));
    }

    @Test
    void normalize_firstRecordAtEpoch1900_startsAtOne() {
        RawTransactionFeed feed = feed(List.of(
                rawTransaction("old-2", "1900-01-01T00:00:00Z", "2.00"),
                rawTransaction("old-1", "1900-01-01T00:00:00Z", "1.00")), List.of());

        assertThat(normalizer.normalize(account, feed))
                .extracting(Transaction::getId, Transaction::getSequenceNumber)
                .containsExactly(tuple("old-1", 1), tuple("old-2", 2));
    }

    @Test
    void normalize_amountsAreExactDecimals() {
        RawTransactionFeed feed = feed(List.of(rawTransaction("b1", "2024-01-01T10:00:00Z", "10.10")), List.of());

        Transaction result = normalizer.normalize(account, feed).get(0);

        assertThat(result.getAmount()).isEqualByComparingTo(new BigDecimal("10.10"));
        assertThat(result.getAmount().scale()).isEqualTo(2);
        assertThat(result.getCurrency()).isEqualTo("GBP");
        assertThat(result.getSourceAmount()).isNull();
        assertThat(result.getSourceCurrency()).isNull();
        assertThat(result.getExchangeRate()).isNull();
    }

    @Test
    void normalize_currencyExchange_extractsSourceFields() {
        RawTransaction raw = rawTransaction("""
                {
                  "transactionId": "fx-1",
                  "bookingDateTime": "2024-01-01T10:00:00Z",
                  "remittanceInformationUnstructured": "HOTEL",
                  "transactionAmount": {"amount": "-11.22", "currency": "EUR"},
                  "currencyExchange": {
                    "sourceCurrency": "USD",
                    "instructedAmount": {"amount": "12.34"},
                    "exchangeRate": "1.1"
                  },
                  "proprietaryBankTransactionCode": "POS"
                }
                """);

        Transaction result = normalizer.normalize(account, feed(List.of(raw), List.of())).get(0);

        assertThat(result.getSourceCurrency()).isEqualTo("USD");
        assertThat(result.getSourceAmount()).isEqualTo(new BigDecimal("12.34"));
        assertThat(result.getExchangeRate()).isCloseTo(1.1, within(1e-9));
        assertThat(result.getTransactionCode()).isEqualTo("POS");
        assertThat(result.getRemittanceInfo()).isEqualTo("HOTEL");
    }

    @Test
    void normalize_currencyExchangeWithoutAmountOrRate_leavesThemNull() {
        RawTransaction raw = rawTransaction("""
                {
                  "transactionId": "fx-2",
                  "bookingDateTime": "2024-01-01T10:00:00Z",
                  "transactionAmount": {"amount": "-1.00", "currency": "EUR"},
                  "currencyExchange": {"sourceCurrency": "SEK", "exchangeRate": ""}
                }
                """);

        Transaction result = normalizer.normalize(account, feed(List.of(raw), List.of())).get(0);

        assertThat(result.getSourceCurrency()).isEqualTo("SEK");
        assertThat(result.getSourceAmount()).isNull();
        assertThat(result.getExchangeRate()).isNull();
    }

    @Test
    void normalize_keepsRawRecordAsSourceData() {
        RawTransaction raw = rawTransaction("b1", "2024-01-01T10:00:00Z", "1.00");

        Transaction result = normalizer.normalize(account, feed(List.of(raw), List.of())).get(0);

        assertThat(result.getSourceData()).isSameAs(raw.sourceData());
    }

    @Test
    void normalize_malformedAmount_failsWithTransactionId() {
        RawTransactionFeed feed = feed(List.of(rawTransaction("bad", "2024-01-01T10:00:00Z", "12,50")), List.of());

        assertThatThrownBy(() -> normalizer.normalize(account, feed))
                .isInstanceOf(MalformedFeedException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bad")
                .hasMessageContaining("12,50");
    }

    @Test
    void normalize_malformedTimestamp_fails() {
        RawTransactionFeed feed = feed(List.of(rawTransaction("bad", "yesterday", "1.00")), List.of());

        assertThatThrownBy(() -> normalizer.normalize(account, feed))
                .isInstanceOf(MalformedFeedException.class)
                .extracting(e -> ((MalformedFeedException) e).getTransactionId())
                .isEqualTo("bad");
    }

    @Test
    void normalize_missingTimestamp_fails() {
        RawTransaction raw = rawTransaction("{\"transactionId\": \"no-time\", "
                + "\"transactionAmount\": {\"amount\": \"1.00\", \"currency\": \"GBP\"}}");

        assertThatThrownBy(() -> normalizer.normalize(account, feed(List.of(raw), List.of())))
                .isInstanceOf(MalformedFeedException.class)
                .hasMessageContaining("bookingDateTime is missing");
    }

    @Test
    void normalize_fixtureFeed_matchesExpectedOrderAndNumbers() {
        RawTransactionFeed feed = TestDataFactory.feedFromResource("/feeds/mixed-feed.json");

        List<Transaction> result = normalizer.normalize(account, feed);

        assertThat(result)
                .extracting(Transaction::getId, Transaction::getSequenceNumber, Transaction::getState)
                .containsExactly(
                        tuple("p-001", 1, TransactionState.PENDING),
                        tuple("b-001", 1, TransactionState.BOOKED),
                        tuple("b-002", 1, TransactionState.BOOKED),
                        tuple("b-003", 2, TransactionState.BOOKED),
                        tuple("b-004", 1, TransactionState.BOOKED));
        assertThat(result.get(3).getSourceAmount()).isEqualTo(new BigDecimal("18.91"));
        assertThat(result.get(4).getTransactionCode()).isEqualTo("DEB");
    }

    @Test
    void normalize_sameFeedTwice_yieldsSameNumbers() {
        RawTransactionFeed feed = TestDataFactory.feedFromResource("/feeds/mixed-feed.json");

        List<Transaction> first = normalizer.normalize(account, feed);
        List<Transaction> second = normalizer.normalize(account, feed);

        assertThat(second).isEqualTo(first);
    }
}
