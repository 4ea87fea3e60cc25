package com.crosslend.core.events;

import java.time.Instant;

public record LendingEvent(
    String type,
    Instant occurredAt,
    Object payload
) {
}
