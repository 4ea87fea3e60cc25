package com.crosslend.core.events.payload;

import java.math.BigInteger;
import java.time.Instant;

public record LedgerActivityEvent(
    String user,
    String asset,
    BigInteger amount,
    String counterparty,
    Instant at
) {
}
