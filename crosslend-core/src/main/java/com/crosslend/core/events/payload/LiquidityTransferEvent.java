package com.crosslend.core.events.payload;

import com.crosslend.core.domain.TransferStatus;

import java.math.BigInteger;
import java.time.Instant;

public record LiquidityTransferEvent(
    String requestId,
    TransferStatus status,
    String requester,
    String asset,
    BigInteger amount,
    long sourceChainId,
    long destinationChainId,
    String messageId,
    String reason,
    Instant at
) {
}
