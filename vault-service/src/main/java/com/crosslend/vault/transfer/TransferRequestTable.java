package com.crosslend.vault.transfer;

import com.crosslend.core.domain.TransferStatus;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PENDING -> COMPLETED | FAILED, exactly once per request.
 */
public class TransferRequestTable {

    private final long chainId;
    private final AtomicLong nonce = new AtomicLong();
    private final Map<String, LiquidityTransferRequest> requests = new ConcurrentHashMap<>();

    public TransferRequestTable(long chainId) {
        this.chainId = chainId;
    }

    /**
     * keccak256(chainId, sourceChainId, requester, asset, amount, nonce). The nonce never repeats, so
     * two identical borrows still get distinct ids.
     */
    public String nextRequestId(long sourceChainId, String requester, String asset, BigInteger amount) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(Numeric.toBytesPadded(BigInteger.valueOf(chainId), 32));
        out.writeBytes(Numeric.toBytesPadded(BigInteger.valueOf(sourceChainId), 32));
        out.writeBytes(Numeric.hexStringToByteArray(requester));
        out.writeBytes(Numeric.hexStringToByteArray(asset));
        out.writeBytes(Numeric.toBytesPadded(amount, 32));
        out.writeBytes(Numeric.toBytesPadded(BigInteger.valueOf(nonce.incrementAndGet()), 32));
        return Numeric.toHexString(Hash.sha3(out.toByteArray()));
    }

    public void open(LiquidityTransferRequest request) {
        if (request.status() != TransferStatus.PENDING) {
            throw new LendingException(ErrorCode.INVALID_STATE, "new request must be PENDING: " + request.requestId());
        }
        if (requests.putIfAbsent(request.requestId(), request) != null) {
            throw new LendingException(ErrorCode.INVALID_STATE, "request " + request.requestId() + " already exists");
        }
    }

    public Optional<LiquidityTransferRequest> find(String requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    public LiquidityTransferRequest get(String requestId) {
        return find(requestId)
                .orElseThrow(() -> new LendingException(ErrorCode.UNKNOWN_REQUEST, "no transfer request " + requestId));
    }

    public LiquidityTransferRequest resolve(String requestId, TransferStatus terminal, String reason, Instant at) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("not a terminal status: " + terminal);
        }
        LiquidityTransferRequest resolved = requests.computeIfPresent(requestId, (id, current) -> {
            if (current.status() != TransferStatus.PENDING) {
                throw new LendingException(ErrorCode.INVALID_STATE,
                        "request " + id + " is already " + current.status());
            }
            return current.resolve(terminal, reason, at);
        });
        if (resolved == null) {
            throw new LendingException(ErrorCode.UNKNOWN_REQUEST, "no transfer request " + requestId);
        }
        return resolved;
    }

    public List<LiquidityTransferRequest> pending() {
        return requests.values().stream()
                .filter(r -> r.status() == TransferStatus.PENDING)
                .sorted(Comparator.comparing(LiquidityTransferRequest::createdAt))
                .toList();
    }

    public List<LiquidityTransferRequest> pendingCreatedBefore(Instant cutoff) {
        return pending().stream().filter(r -> r.createdAt().isBefore(cutoff)).toList();
    }

    public List<LiquidityTransferRequest> forRequester(String requester) {
        return requests.values().stream()
                .filter(r -> r.requester().equals(requester))
                .sorted(Comparator.comparing(LiquidityTransferRequest::createdAt))
                .toList();
    }

    /**
     * Debt still in flight for this user and asset, per liquidity source.
     */
    public Map<String, BigInteger> lockedPrincipal(String requester, String asset) {
        Map<String, BigInteger> locked = new HashMap<>();
        for (LiquidityTransferRequest r : pending()) {
            if (r.requester().equals(requester) && r.asset().equals(asset)) {
                locked.merge(r.sourceId(), r.debt(), BigInteger::add);
            }
        }
        return locked;
    }

    public int pendingCount() {
        return (int) requests.values().stream().filter(r -> r.status() == TransferStatus.PENDING).count();
    }
}
