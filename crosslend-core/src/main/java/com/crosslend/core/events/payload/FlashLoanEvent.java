package com.crosslend.core.events.payload;

import java.math.BigInteger;
import java.time.Instant;

public record FlashLoanEvent(
    String initiator,
    String receiver,
    String asset,
    BigInteger amount,
    BigInteger fee,
    Instant at
) {
}
