package com.crosslend.vault.events;

import com.crosslend.core.events.LendingEvent;
import com.crosslend.core.events.LendingEventTypes;
import com.crosslend.core.events.payload.LedgerActivityEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LendingEventJournalTest {

    private static final Instant AT = Instant.parse("2025-01-01T00:00:00Z");
    private static final String ETH = "0x00000000000000000000000000000000000000e1";

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final LendingEventJournal journal = new LendingEventJournal(mapper);

    @Test
    void writesEnvelopeWithPayloadFields() {
        journal.onEvent(deposit("0xa11ce", 10));

        List<JsonNode> events = journal.recent(10, null);
        assertThat(events).hasSize(1);
        JsonNode node = events.get(0);
        assertThat(node.path("seq").asLong()).isEqualTo(1L);
        assertThat(node.path("ts").asText()).isEqualTo("2025-01-01T00:00:00Z");
        assertThat(node.path("source").asText()).isEqualTo(LendingEventJournal.SOURCE);
        assertThat(node.path("type").asText()).isEqualTo(LendingEventTypes.DEPOSIT);
        assertThat(node.path("data").path("user").asText()).isEqualTo("0xa11ce");
        assertThat(node.path("data").path("amount").bigIntegerValue()).isEqualTo(BigInteger.TEN);
        assertThat(node.path("data").path("at").asText()).isEqualTo("2025-01-01T00:00:00Z");
    }

    @Test
    void newestFirstAndFilteredByType() {
        journal.onEvent(deposit("0xa", 1));
        journal.onEvent(new LendingEvent(LendingEventTypes.BORROW, AT,
                new LedgerActivityEvent("0xb", ETH, BigInteger.TWO, null, AT)));
        journal.onEvent(deposit("0xc", 3));

        assertThat(journal.recent(10, null)).extracting(n -> n.path("data").path("user").asText())
                .containsExactly("0xc", "0xb", "0xa");
        assertThat(journal.recent(10, LendingEventTypes.DEPOSIT)).hasSize(2);
        assertThat(journal.recent(1, "")).hasSize(1);
    }

    @Test
    void evictsOldestBeyondCapacity() {
        for (int i = 0; i < LendingEventJournal.CAPACITY + 5; i++) {
            journal.onEvent(deposit("0x" + i, 1));
        }

        List<JsonNode> all = journal.recent(Integer.MAX_VALUE, null);
        assertThat(all).hasSize(LendingEventJournal.CAPACITY);
        assertThat(all.get(all.size() - 1).path("seq").asLong()).isEqualTo(6L);
    }

    @Test
    void unserializablePayloadIsCountedNotThrown() {
        journal.onEvent(new LendingEvent("lending.test", AT, new Object()));

        assertThat(journal.droppedCount()).isEqualTo(1L);
        assertThat(journal.recent(10, null)).isEmpty();
    }

    private static LendingEvent deposit(String user, long amount) {
        return new LendingEvent(LendingEventTypes.DEPOSIT, AT,
                new LedgerActivityEvent(user, ETH, BigInteger.valueOf(amount), null, AT));
    }
}
