package com.crosslend.vault.events;

import com.crosslend.core.events.LendingEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the most recent lending events as JSON envelopes and writes each one to the log.
 * Oldest entries are evicted once {@link #CAPACITY} is reached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LendingEventJournal {

    static final int CAPACITY = 1_000;
    static final String SOURCE = "crosslend-vault";

    private final @NonNull ObjectMapper objectMapper;

    private final Deque<JsonNode> recent = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    @EventListener
    public void onEvent(LendingEvent event) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("seq", sequence.incrementAndGet());
        envelope.put("ts", event.occurredAt().toString());
        envelope.put("source", SOURCE);
        envelope.put("type", event.type());
        envelope.put("data", event.payload());

        JsonNode node;
        try {
            node = objectMapper.valueToTree(envelope);
            log.info("lending event {}", objectMapper.writeValueAsString(node));
        } catch (Exception e) {
            dropped.incrementAndGet();
            log.warn("Failed to journal event type={}: {}", event.type(), e.getMessage());
            return;
        }
        synchronized (recent) {
            if (recent.size() == CAPACITY) {
                recent.removeFirst();
            }
            recent.addLast(node);
        }
    }

    /** Newest first, optionally narrowed to one event type. */
    public List<JsonNode> recent(int limit, String type) {
        List<JsonNode> out = new ArrayList<>();
        synchronized (recent) {
            var it = recent.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                JsonNode node = it.next();
                if (type == null || type.isBlank() || type.equals(node.path("type").asText())) {
                    out.add(node);
                }
            }
        }
        return out;
    }

    public long droppedCount() {
        return dropped.get();
    }
}
