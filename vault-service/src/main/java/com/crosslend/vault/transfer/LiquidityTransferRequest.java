package com.crosslend.vault.transfer;

import com.crosslend.core.domain.TransferStatus;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A borrow funded from another chain, tracked until the funds land or the transfer is abandoned.
 *
 * @param requester  account carrying the debt
 * @param recipient  account the released funds are delivered to
 * @param sourceId   liquidity source that reserved the funds
 * @param fee        bridge fee added to the requester's debt on top of {@code amount}
 */
public record LiquidityTransferRequest(
        String requestId,
        String requester,
        String recipient,
        String sourceId,
        long sourceChainId,
        long destinationChainId,
        String asset,
        BigInteger amount,
        BigInteger fee,
        Instant createdAt,
        TransferStatus status,
        String protocol,
        String messageId,
        Instant resolvedAt,
        String reason
) {

    public BigInteger debt() {
        return amount.add(fee);
    }

    LiquidityTransferRequest resolve(TransferStatus terminal, String reason, Instant at) {
        return new LiquidityTransferRequest(requestId, requester, recipient, sourceId, sourceChainId, destinationChainId,
                asset, amount, fee, createdAt, terminal, protocol, messageId, at, reason);
    }
}
