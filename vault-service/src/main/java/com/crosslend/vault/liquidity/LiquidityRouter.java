package com.crosslend.vault.liquidity;

import com.crosslend.core.domain.BatchResult;
import com.crosslend.core.domain.LiquidityQuote;
import com.crosslend.core.domain.TransferStatus;
import com.crosslend.core.error.ErrorCategory;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import com.crosslend.core.events.LendingEventPublisher;
import com.crosslend.core.events.LendingEventTypes;
import com.crosslend.core.events.payload.LiquidityTransferEvent;
import com.crosslend.core.rate.RateMath;
import com.crosslend.vault.transfer.LiquidityTransferRequest;
import com.crosslend.vault.transfer.TransferRequestTable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Picks the cheapest source able to fund a borrow and executes against it.
 * <p>
 * Cost is the upfront fee plus the source's annual rate pro-rated over the expected holding period.
 * Ties go to the faster source, then to the one registered first, so the choice is a pure function
 * of the quotes.
 */
@Slf4j
public class LiquidityRouter {

    private static final BigInteger YEAR = BigInteger.valueOf(RateMath.SECONDS_PER_YEAR);

    private final TransferRequestTable transfers;
    private final LendingEventPublisher events;
    private final Clock clock;
    private final long holdingSeconds;
    private final long chainId;

    private final List<LiquiditySource> sources = new CopyOnWriteArrayList<>();
    private final Map<String, LiquiditySource> byId = new ConcurrentHashMap<>();
    private final List<PendingReturn> pendingReturns = new CopyOnWriteArrayList<>();

    public LiquidityRouter(
            @NonNull TransferRequestTable transfers,
            @NonNull LendingEventPublisher events,
            @NonNull Clock clock,
            @NonNull Duration holdingPeriod,
            long chainId
    ) {
        this.transfers = transfers;
        this.events = events;
        this.clock = clock;
        this.holdingSeconds = holdingPeriod.getSeconds();
        this.chainId = chainId;
    }

    public void register(@NonNull LiquiditySource source) {
        if (byId.putIfAbsent(source.id(), source) != null) {
            throw new LendingException(ErrorCode.ALREADY_REGISTERED, "liquidity source " + source.id() + " is already registered");
        }
        sources.add(source);
        log.info("liquidity source registered id={} type={} async={}", source.id(), source.type(), source.isAsynchronous());
    }

    public List<String> sourceOrder() {
        return sources.stream().map(LiquiditySource::id).toList();
    }

    public Optional<LiquiditySource> source(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public <T extends LiquiditySource> List<T> sourcesOf(Class<T> type) {
        return sources.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public boolean supports(String asset) {
        return sources.stream().anyMatch(s -> s.supportsAsset(asset));
    }

    /**
     * Non-empty quotes from every source that supports the asset, in registration order. A source
     * that fails to quote is skipped.
     */
    public List<LiquidityQuote> quotes(String asset, BigInteger amount) {
        List<LiquidityQuote> quotes = new ArrayList<>();
        for (LiquiditySource source : sources) {
            if (!source.supportsAsset(asset)) {
                continue;
            }
            try {
                LiquidityQuote quote = source.quote(asset, amount);
                if (quote != null && !quote.isEmpty()) {
                    quotes.add(quote);
                }
            } catch (RuntimeException e) {
                log.warn("liquidity source {} failed to quote {} {}: {}", source.id(), amount, asset, e.getMessage());
            }
        }
        return quotes;
    }

    public Optional<LiquidityQuote> route(String asset, BigInteger amount) {
        return select(quotes(asset, amount));
    }

    /**
     * Best of the given quotes. Quotes that cover the full request beat partial ones.
     */
    public Optional<LiquidityQuote> select(List<LiquidityQuote> quotes) {
        List<LiquidityQuote> candidates = quotes.stream().filter(q -> !q.isEmpty()).toList();
        if (candidates.stream().anyMatch(LiquidityQuote::coversRequest)) {
            candidates = candidates.stream().filter(LiquidityQuote::coversRequest).toList();
        }
        return candidates.stream().min(
                Comparator.comparing(this::cost)
                        .thenComparingLong(LiquidityQuote::settlementSeconds)
                        .thenComparingInt(this::registrationIndex));
    }

    /**
     * Funds {@code recipient} from the quoted source. For an asynchronous source this opens a
     * PENDING transfer request and returns its id; the funds arrive when the request completes.
     */
    public Execution execute(LiquidityQuote quote, String recipient, String borrower) {
        LiquiditySource source = byId.get(quote.sourceId());
        if (source == null) {
            throw new LendingException(ErrorCode.NO_LIQUIDITY_ROUTE, "unknown liquidity source " + quote.sourceId());
        }
        BigInteger amount = quote.availableAmount();
        BigInteger fee = quote.feeAmount();
        if (!source.isAsynchronous()) {
            source.borrow(quote.asset(), amount, recipient, new LiquiditySource.BorrowContext(borrower, ""));
            return new Execution(source.id(), amount, fee, "");
        }

        String requestId = transfers.nextRequestId(quote.originChainId(), borrower, quote.asset(), amount);
        LiquiditySource.BorrowOutcome outcome =
                source.borrow(quote.asset(), amount, recipient, new LiquiditySource.BorrowContext(borrower, requestId));
        if (!outcome.success()) {
            throw new LendingException(ErrorCode.SOURCE_UNAVAILABLE, source.id() + " refused to fund " + amount + " " + quote.asset());
        }
        Instant now = clock.instant();
        LiquidityTransferRequest request = new LiquidityTransferRequest(requestId, borrower, recipient, source.id(),
                quote.originChainId(), chainId, quote.asset(), amount, fee, now, TransferStatus.PENDING,
                outcome.protocol(), outcome.messageId(), null, null);
        transfers.open(request);
        log.info("liquidity transfer initiated requestId={} source={} amount={} fee={} messageId={}",
                requestId, source.id(), amount, fee, outcome.messageId());
        publish(LendingEventTypes.TRANSFER_INITIATED, request);
        return new Execution(source.id(), amount, fee, requestId);
    }

    /**
     * Moves a PENDING request to COMPLETED or FAILED and lets its source settle. Debt bookkeeping is
     * the caller's job.
     */
    public LiquidityTransferRequest complete(String requestId, boolean success, String reason) {
        TransferStatus terminal = success ? TransferStatus.COMPLETED : TransferStatus.FAILED;
        LiquidityTransferRequest resolved = transfers.resolve(requestId, terminal, reason, clock.instant());
        LiquiditySource source = byId.get(resolved.sourceId());
        if (source != null) {
            source.onTransferResolved(resolved);
        } else {
            log.warn("transfer {} resolved but source {} is gone", requestId, resolved.sourceId());
        }
        if (success) {
            log.info("liquidity transfer completed requestId={} amount={}", requestId, resolved.amount());
            publish(LendingEventTypes.TRANSFER_COMPLETED, resolved);
        } else {
            log.warn("liquidity transfer failed requestId={} amount={} reason={}", requestId, resolved.amount(), reason);
            publish(LendingEventTypes.TRANSFER_FAILED, resolved);
        }
        return resolved;
    }

    /**
     * Hands repaid principal back to the source that lent it. If the source is temporarily
     * unreachable the amount is parked and retried by {@link #flushPendingReturns()}.
     */
    public void returnPrincipal(String sourceId, String asset, BigInteger amount) {
        LiquiditySource source = byId.get(sourceId);
        if (source == null) {
            throw new LendingException(ErrorCode.INVALID_STATE, "principal owed to unknown source " + sourceId);
        }
        try {
            source.repay(asset, amount);
        } catch (LendingException e) {
            if (e.category() != ErrorCategory.EXTERNAL) {
                throw e;
            }
            log.warn("returning {} {} to {} failed, parking: {}", amount, asset, sourceId, e.getMessage());
            pendingReturns.add(new PendingReturn(sourceId, asset, amount));
        }
    }

    public BatchResult<PendingReturn, BigInteger> flushPendingReturns() {
        BatchResult<PendingReturn, BigInteger> result = new BatchResult<>();
        for (PendingReturn pending : List.copyOf(pendingReturns)) {
            try {
                byId.get(pending.sourceId()).repay(pending.asset(), pending.amount());
                pendingReturns.remove(pending);
                result.succeeded(pending, pending.amount());
            } catch (LendingException e) {
                log.warn("parked return to {} still failing: {}", pending.sourceId(), e.getMessage());
                result.failed(pending, e.getMessage());
            }
        }
        return result;
    }

    public List<PendingReturn> pendingReturns() {
        return List.copyOf(pendingReturns);
    }

    private BigInteger cost(LiquidityQuote quote) {
        // both terms scaled by seconds-per-year so the holding-period proration stays exact
        BigInteger fee = BigInteger.valueOf(quote.feeBps()).multiply(YEAR);
        BigInteger rate = BigInteger.valueOf(quote.annualRateBps()).multiply(BigInteger.valueOf(holdingSeconds));
        return fee.add(rate);
    }

    private int registrationIndex(LiquidityQuote quote) {
        int index = sourceOrder().indexOf(quote.sourceId());
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    private void publish(String type, LiquidityTransferRequest request) {
        events.publish(type, new LiquidityTransferEvent(request.requestId(), request.status(), request.requester(),
                request.asset(), request.amount(), request.sourceChainId(), request.destinationChainId(),
                request.messageId(), request.reason(), clock.instant()));
    }

    /**
     * @param requestId empty unless the source is asynchronous
     */
    public record Execution(String sourceId, BigInteger amount, BigInteger fee, String requestId) {

        public boolean pending() {
            return !requestId.isEmpty();
        }

        public BigInteger debt() {
            return amount.add(fee);
        }
    }

    public record PendingReturn(String sourceId, String asset, BigInteger amount) {
    }
}
