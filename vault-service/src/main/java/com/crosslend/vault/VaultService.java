package com.crosslend.vault;

import com.crosslend.core.access.AccessControl;
import com.crosslend.core.compliance.CompliancePolicy;
import com.crosslend.core.config.LendingProperties;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.domain.BatchResult;
import com.crosslend.core.domain.LiquidityQuote;
import com.crosslend.core.domain.RateMode;
import com.crosslend.core.domain.Role;
import com.crosslend.core.domain.SystemState;
import com.crosslend.core.domain.TransferStatus;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import com.crosslend.core.events.LendingEventPublisher;
import com.crosslend.core.events.LendingEventTypes;
import com.crosslend.core.events.payload.FlashLoanEvent;
import com.crosslend.core.events.payload.LedgerActivityEvent;
import com.crosslend.core.events.payload.LiquidationEvent;
import com.crosslend.core.oracle.PriceOracle;
import com.crosslend.core.rate.RateMath;
import com.crosslend.vault.custody.AssetCustody;
import com.crosslend.vault.flash.FlashLoanModule;
import com.crosslend.vault.flash.FlashLoanReceiver;
import com.crosslend.vault.ledger.AssetRegistry;
import com.crosslend.vault.ledger.CollateralLedger;
import com.crosslend.vault.liquidity.LiquidityRouter;
import com.crosslend.vault.transfer.LiquidityTransferRequest;
import com.crosslend.vault.transfer.TransferRequestTable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Entry point for every state change on this chain's vault.
 * <p>
 * Mutations run one at a time under a single execution lock. Calling back into a mutating method
 * from inside one (a flash-loan receiver depositing, for instance) fails with ReentrantCall instead
 * of deadlocking or interleaving. Every mutating method except transfer resolution is refused while
 * the system is paused, so in-flight bridge transfers can still settle.
 */
@Slf4j
public class VaultService {

    private static final BigDecimal BPS = BigDecimal.valueOf(RateMath.BPS);

    private final CollateralLedger ledger;
    private final AssetRegistry assets;
    private final AssetCustody custody;
    private final LiquidityRouter router;
    private final TransferRequestTable transfers;
    private final FlashLoanModule flashLoans;
    private final CompliancePolicy compliance;
    private final AccessControl access;
    private final PriceOracle oracle;
    private final LendingEventPublisher events;
    private final LendingProperties.Risk risk;
    private final Duration transferTimeout;
    private final String vaultAddress;
    private final Clock clock;

    private final ReentrantLock executionLock = new ReentrantLock();
    private volatile SystemState state = SystemState.ACTIVE;
    // debtor|delegatee|asset -> remaining borrow allowance
    private final Map<String, BigInteger> delegations = new ConcurrentHashMap<>();

    private final Counter depositsCounter;
    private final Counter withdrawalsCounter;
    private final Counter borrowsCounter;
    private final Counter repaymentsCounter;
    private final Counter liquidationsCounter;
    private final Counter flashLoansCounter;
    private final Counter expiredTransfersCounter;

    public VaultService(
            @NonNull CollateralLedger ledger,
            @NonNull AssetRegistry assets,
            @NonNull AssetCustody custody,
            @NonNull LiquidityRouter router,
            @NonNull TransferRequestTable transfers,
            @NonNull FlashLoanModule flashLoans,
            @NonNull CompliancePolicy compliance,
            @NonNull AccessControl access,
            @NonNull PriceOracle oracle,
            @NonNull LendingEventPublisher events,
            @NonNull LendingProperties properties,
            @NonNull Clock clock,
            @NonNull MeterRegistry meterRegistry
    ) {
        this.ledger = ledger;
        this.assets = assets;
        this.custody = custody;
        this.router = router;
        this.transfers = transfers;
        this.flashLoans = flashLoans;
        this.compliance = compliance;
        this.access = access;
        this.oracle = oracle;
        this.events = events;
        this.risk = properties.risk();
        this.transferTimeout = properties.transfers().timeout();
        this.vaultAddress = Assets.normalize(properties.chain().vaultAddress());
        this.clock = clock;

        this.depositsCounter = counter(meterRegistry, "crosslend.vault.deposits", "Collateral deposits accepted");
        this.withdrawalsCounter = counter(meterRegistry, "crosslend.vault.withdrawals", "Collateral withdrawals paid out");
        this.borrowsCounter = counter(meterRegistry, "crosslend.vault.borrows", "Borrows funded or initiated");
        this.repaymentsCounter = counter(meterRegistry, "crosslend.vault.repayments", "Repayments applied");
        this.liquidationsCounter = counter(meterRegistry, "crosslend.vault.liquidations", "Positions liquidated");
        this.flashLoansCounter = counter(meterRegistry, "crosslend.vault.flash-loans", "Flash loans repaid");
        this.expiredTransfersCounter = counter(meterRegistry, "crosslend.vault.transfers.expired",
                "Pending transfers failed by the timeout sweep");
        Gauge.builder("crosslend.vault.transfers.pending", transfers, TransferRequestTable::pendingCount)
                .description("Cross-chain transfers awaiting completion")
                .register(meterRegistry);
    }

    public String vaultAddress() {
        return vaultAddress;
    }

    public SystemState state() {
        return state;
    }

    public void deposit(String caller, String asset, BigInteger amount) {
        String user = Assets.normalize(caller);
        String token = assets.require(asset);
        requirePositive(amount);
        mutate(() -> {
            requireActive();
            compliance.require(user, "deposit");
            custody.transfer(token, user, vaultAddress, amount);
            ledger.recordDeposit(user, token, amount);
            depositsCounter.increment();
            log.info("deposit user={} asset={} amount={}", user, token, amount);
            publish(LendingEventTypes.DEPOSIT, user, token, amount, null);
            return null;
        });
    }

    public void withdraw(String caller, String asset, BigInteger amount) {
        String user = Assets.normalize(caller);
        String token = assets.require(asset);
        requirePositive(amount);
        mutate(() -> {
            requireActive();
            ledger.accrueAll(user);
            BigInteger deposited = ledger.deposited(user, token);
            if (deposited.compareTo(amount) < 0) {
                throw new LendingException(ErrorCode.INSUFFICIENT_COLLATERAL,
                        user + " has " + deposited + " of " + token + ", cannot withdraw " + amount);
            }
            HealthFactor after = ledger.prospectiveHealthFactor(user, ledger.valueOf(token, amount), BigDecimal.ZERO);
            if (after.isBelow(risk.minHealthFactor())) {
                throw new LendingException(ErrorCode.UNDERCOLLATERALIZED,
                        "withdrawal would leave health factor at " + after.value());
            }
            ledger.recordWithdrawal(user, token, amount);
            custody.transfer(token, vaultAddress, user, amount);
            withdrawalsCounter.increment();
            log.info("withdraw user={} asset={} amount={}", user, token, amount);
            publish(LendingEventTypes.WITHDRAW, user, token, amount, null);
            return null;
        });
    }

    /**
     * Lets {@code delegatee} borrow up to {@code amount} of {@code asset} against the caller's
     * collateral. Replaces any earlier allowance.
     */
    public void approveDelegation(String caller, String delegatee, String asset, BigInteger amount) {
        String debtor = Assets.normalize(caller);
        String key = delegationKey(debtor, Assets.normalize(delegatee), assets.require(asset));
        if (amount == null || amount.signum() <= 0) {
            delegations.remove(key);
        } else {
            delegations.put(key, amount);
        }
        log.info("borrow delegation set debtor={} delegatee={} asset={} amount={}", debtor, delegatee, asset, amount);
    }

    public BigInteger delegatedAllowance(String debtor, String delegatee, String asset) {
        return delegations.getOrDefault(
                delegationKey(Assets.normalize(debtor), Assets.normalize(delegatee), Assets.normalize(asset)), BigInteger.ZERO);
    }

    /**
     * Borrows for {@code onBehalfOf} (the caller when null) and pays the caller. Funds routed from
     * another chain arrive later; the debt is booked now and rolled back if the transfer fails.
     */
    public BorrowResult borrow(String caller, String asset, BigInteger amount, String onBehalfOf, RateMode rateMode) {
        String recipient = Assets.normalize(caller);
        String debtor = onBehalfOf == null || onBehalfOf.isBlank() ? recipient : Assets.normalize(onBehalfOf);
        String token = assets.require(asset);
        requirePositive(amount);
        return mutate(() -> {
            requireActive();
            compliance.require(recipient, "borrow");
            if (!debtor.equals(recipient)) {
                requireDelegation(debtor, recipient, token, amount);
            }
            ledger.accrueAll(debtor);

            if (!router.supports(token)) {
                throw new LendingException(ErrorCode.NO_LIQUIDITY_ROUTE, "no liquidity source lends " + token);
            }
            LiquidityQuote quote = router.route(token, amount)
                    .filter(LiquidityQuote::coversRequest)
                    .orElseThrow(() -> new LendingException(ErrorCode.INSUFFICIENT_LIQUIDITY,
                            "no source can fund " + amount + " of " + token));
            BigInteger debt = amount.add(quote.feeAmount());

            HealthFactor after = ledger.prospectiveHealthFactor(debtor, BigDecimal.ZERO, ledger.valueOf(token, debt));
            if (after.isBelow(risk.minHealthFactor())) {
                throw new LendingException(ErrorCode.UNDERCOLLATERALIZED,
                        "borrow would leave health factor at " + after.value());
            }

            LiquidityRouter.Execution execution = router.execute(quote, recipient, debtor);
            ledger.recordBorrow(debtor, token, execution.sourceId(), execution.debt(), rateMode, execution.pending());
            if (!debtor.equals(recipient)) {
                delegations.computeIfPresent(delegationKey(debtor, recipient, token), (k, left) -> {
                    BigInteger rest = left.subtract(amount);
                    return rest.signum() > 0 ? rest : null;
                });
            }
            borrowsCounter.increment();
            log.info("borrow debtor={} recipient={} asset={} amount={} fee={} source={} requestId={}",
                    debtor, recipient, token, amount, execution.fee(), execution.sourceId(), execution.requestId());
            publish(LendingEventTypes.BORROW, debtor, token, amount, recipient);
            return new BorrowResult(debtor, token, amount, execution.fee(), execution.sourceId(),
                    execution.pending() ? execution.requestId() : null);
        });
    }

    /**
     * Pays down {@code onBehalfOf}'s debt (the caller's when null) from the caller's balance. Only
     * {@code min(amount, repayable debt)} is taken; debt whose funds are still in flight is not
     * repayable until its transfer settles.
     */
    public RepayResult repay(String caller, String asset, BigInteger amount, String onBehalfOf) {
        String payer = Assets.normalize(caller);
        String debtor = onBehalfOf == null || onBehalfOf.isBlank() ? payer : Assets.normalize(onBehalfOf);
        String token = assets.require(asset);
        requirePositive(amount);
        return mutate(() -> {
            requireActive();
            ledger.accrueAll(debtor);
            Map<String, BigInteger> locked = transfers.lockedPrincipal(debtor, token);
            BigInteger lockedTotal = locked.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
            BigInteger repayable = RateMath.saturatingSub(ledger.debt(debtor, token), lockedTotal);
            BigInteger pay = amount.min(repayable);
            if (pay.signum() == 0) {
                log.debug("repay with nothing repayable debtor={} asset={}", debtor, token);
                return new RepayResult(debtor, token, BigInteger.ZERO, BigInteger.ZERO, amount);
            }
            BigInteger balance = custody.balanceOf(token, payer);
            if (balance.compareTo(pay) < 0) {
                throw new LendingException(ErrorCode.INSUFFICIENT_BALANCE, payer + " holds " + balance + " of " + token + ", owes " + pay);
            }

            CollateralLedger.Repayment repayment = ledger.applyRepayment(debtor, token, pay, router.sourceOrder(), locked);
            BigInteger paid = repayment.total();
            custody.transfer(token, payer, vaultAddress, paid);
            repayment.principal().forEach((sourceId, principal) -> router.returnPrincipal(sourceId, token, principal));

            repaymentsCounter.increment();
            BigInteger refunded = amount.subtract(paid);
            log.info("repay debtor={} payer={} asset={} paid={} interest={} refunded={}",
                    debtor, payer, token, paid, repayment.interest(), refunded);
            publish(LendingEventTypes.REPAY, debtor, token, paid, payer);
            return new RepayResult(debtor, token, paid, repayment.interest(), refunded);
        });
    }

    public void switchRateMode(String caller, String asset, @NonNull RateMode mode) {
        String user = Assets.normalize(caller);
        String token = assets.require(asset);
        mutate(() -> {
            requireActive();
            ledger.accrueInterest(user, token);
            ledger.switchRateMode(user, token, mode);
            log.info("rate mode switched user={} asset={} mode={}", user, token, mode);
            publish(LendingEventTypes.RATE_MODE_SWITCH, user, token, ledger.debt(user, token), null);
            return null;
        });
    }

    /**
     * Repays part of an unhealthy position's debt and takes collateral worth the repaid value plus
     * the liquidation penalty. When the user's collateral cannot cover that, the whole balance is
     * seized and the repayment shrinks to match.
     */
    public LiquidationResult liquidate(String caller, String user, String debtAsset, BigInteger amount, String collateralAsset) {
        String liquidator = Assets.normalize(caller);
        String borrower = Assets.normalize(user);
        String debtToken = assets.require(debtAsset);
        String collateralToken = assets.require(collateralAsset);
        requirePositive(amount);
        return mutate(() -> {
            requireActive();
            ledger.accrueAll(borrower);
            HealthFactor before = ledger.healthFactor(borrower);
            if (!before.isBelow(risk.liquidationThreshold())) {
                throw new LendingException(ErrorCode.HEALTHY_POSITION,
                        borrower + " health factor " + (before.unbounded() ? "unbounded" : before.value()) + " is not below "
                                + risk.liquidationThreshold());
            }
            Map<String, BigInteger> locked = transfers.lockedPrincipal(borrower, debtToken);
            BigInteger lockedTotal = locked.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
            BigInteger repay = amount.min(RateMath.saturatingSub(ledger.debt(borrower, debtToken), lockedTotal));
            if (repay.signum() == 0) {
                throw new LendingException(ErrorCode.INVALID_STATE, borrower + " has no repayable " + debtToken + " debt");
            }

            BigDecimal penalty = BPS.add(BigDecimal.valueOf(risk.liquidationPenaltyBps())).divide(BPS);
            BigInteger seize = ledger.amountFor(ledger.valueOf(debtToken, repay).multiply(penalty), collateralToken);
            BigInteger available = ledger.deposited(borrower, collateralToken);
            if (available.signum() == 0) {
                throw new LendingException(ErrorCode.INSUFFICIENT_COLLATERAL, borrower + " has no " + collateralToken + " collateral");
            }
            if (seize.compareTo(available) > 0) {
                repay = new BigDecimal(repay).multiply(new BigDecimal(available))
                        .divide(new BigDecimal(seize), 0, RoundingMode.DOWN).toBigIntegerExact();
                seize = available;
            }
            if (repay.signum() == 0 || seize.signum() == 0) {
                throw new LendingException(ErrorCode.INVALID_STATE, "liquidation of " + amount + " rounds to nothing");
            }
            var pool = ledger.pool(collateralToken);
            if (pool.getTotalDeposited().subtract(seize).compareTo(pool.getTotalBorrowed()) < 0) {
                throw new LendingException(ErrorCode.INSUFFICIENT_LIQUIDITY,
                        "seizing " + seize + " of " + collateralToken + " would leave the pool below its borrowed total");
            }
            BigInteger balance = custody.balanceOf(debtToken, liquidator);
            if (balance.compareTo(repay) < 0) {
                throw new LendingException(ErrorCode.INSUFFICIENT_BALANCE, liquidator + " holds " + balance + " of " + debtToken);
            }

            CollateralLedger.Repayment repayment = ledger.applyRepayment(borrower, debtToken, repay, router.sourceOrder(), locked);
            custody.transfer(debtToken, liquidator, vaultAddress, repayment.total());
            repayment.principal().forEach((sourceId, principal) -> router.returnPrincipal(sourceId, debtToken, principal));
            ledger.seizeCollateral(borrower, collateralToken, seize);
            custody.transfer(collateralToken, vaultAddress, liquidator, seize);

            liquidationsCounter.increment();
            log.warn("liquidation user={} liquidator={} repaid={} {} seized={} {} healthFactor={}",
                    borrower, liquidator, repayment.total(), debtToken, seize, collateralToken, before.value());
            events.publish(LendingEventTypes.LIQUIDATION, new LiquidationEvent(borrower, liquidator, debtToken,
                    repayment.total(), collateralToken, seize, before.value(), clock.instant()));
            return new LiquidationResult(borrower, debtToken, repayment.total(), collateralToken, seize);
        });
    }

    public BigInteger flashLoan(String caller, FlashLoanReceiver receiver, String asset, BigInteger amount, byte[] data) {
        String initiator = Assets.normalize(caller);
        String token = assets.require(asset);
        requirePositive(amount);
        return mutate(() -> {
            requireActive();
            BigInteger fee = flashLoans.execute(initiator, receiver, token, amount, data);
            flashLoansCounter.increment();
            events.publish(LendingEventTypes.FLASH_LOAN,
                    new FlashLoanEvent(initiator, receiver.address(), token, amount, fee, clock.instant()));
            return fee;
        });
    }

    public LiquidityTransferRequest completeLiquidityTransfer(String caller, String requestId, boolean success, String reason) {
        access.requireRole(Assets.normalize(caller), Role.COMPLETION_CALLER);
        return mutate(() -> resolveTransfer(requestId, success, reason));
    }

    /**
     * Resolution reported by the funding vault itself over the bridge. The message's origin is
     * checked against the request's source before anything changes.
     */
    public LiquidityTransferRequest resolveFromBridge(String sourceId, String requestId, boolean success, String reason) {
        return mutate(() -> {
            LiquidityTransferRequest request = transfers.get(requestId);
            if (!request.sourceId().equals(sourceId)) {
                throw new LendingException(ErrorCode.UNAUTHORIZED,
                        sourceId + " cannot resolve request " + requestId + " funded by " + request.sourceId());
            }
            return resolveTransfer(requestId, success, reason);
        });
    }

    /**
     * Fails every PENDING transfer older than the configured timeout. One bad request does not stop
     * the sweep.
     */
    public BatchResult<String, TransferStatus> expireStaleTransfers() {
        return mutate(() -> {
            BatchResult<String, TransferStatus> result = new BatchResult<>();
            Instant cutoff = clock.instant().minus(transferTimeout);
            for (LiquidityTransferRequest stale : transfers.pendingCreatedBefore(cutoff)) {
                try {
                    resolveTransfer(stale.requestId(), false, "timed out after " + transferTimeout);
                    expiredTransfersCounter.increment();
                    result.succeeded(stale.requestId(), TransferStatus.FAILED);
                } catch (LendingException e) {
                    log.warn("could not expire transfer {}: {}", stale.requestId(), e.getMessage());
                    result.failed(stale.requestId(), e.getMessage());
                }
            }
            if (!result.items().isEmpty()) {
                log.info("transfer sweep expired={} failed={}", result.successCount(), result.failureCount());
            }
            return result;
        });
    }

    public BatchResult<LiquidityRouter.PendingReturn, BigInteger> retryPendingReturns() {
        return mutate(router::flushPendingReturns);
    }

    private LiquidityTransferRequest resolveTransfer(String requestId, boolean success, String reason) {
        LiquidityTransferRequest resolved = router.complete(requestId, success, reason);
        if (success) {
            ledger.settleInFlight(resolved.requester(), resolved.asset(), resolved.debt());
        } else {
            BigInteger removed = ledger.rollbackBorrow(resolved.requester(), resolved.asset(), resolved.sourceId(), resolved.debt());
            log.info("optimistic debt rolled back requestId={} user={} amount={}", requestId, resolved.requester(), removed);
        }
        return resolved;
    }

    public HealthFactor healthFactor(String user) {
        return ledger.healthFactor(Assets.normalize(user));
    }

    /**
     * Brings one debt up to date. Safe to call at any time; a second call in the same instant is a no-op.
     */
    public BigInteger accrueInterest(String user, String asset) {
        String account = Assets.normalize(user);
        String token = assets.require(asset);
        return mutate(() -> ledger.accrueInterest(account, token));
    }

    public Optional<LiquidityTransferRequest> transfer(String requestId) {
        return transfers.find(requestId);
    }

    public void pause(String caller) {
        setState(caller, SystemState.PAUSED);
    }

    public void unpause(String caller) {
        setState(caller, SystemState.ACTIVE);
    }

    public void grantRole(String caller, Role role, String account) {
        access.grant(Assets.normalize(caller), role, account);
    }

    public void revokeRole(String caller, Role role, String account) {
        access.revoke(Assets.normalize(caller), role, account);
    }

    /**
     * Lists a new asset. The oracle must already price it.
     */
    public void listAsset(String caller, LendingProperties.Asset asset) {
        access.requireRole(Assets.normalize(caller), Role.OWNER);
        String address = Assets.normalize(asset.address());
        oracle.convertToUSD(address, BigInteger.ONE);
        assets.list(asset);
    }

    private void setState(String caller, SystemState next) {
        access.requireRole(Assets.normalize(caller), Role.OWNER);
        SystemState previous = state;
        state = next;
        if (previous != next) {
            log.warn("vault state {} -> {} by {}", previous, next, caller);
            events.publish(LendingEventTypes.SYSTEM_STATE_CHANGED, next);
        }
    }

    private <T> T mutate(Supplier<T> operation) {
        if (executionLock.isHeldByCurrentThread()) {
            throw new LendingException(ErrorCode.REENTRANT_CALL, "vault is already executing a mutation on this thread");
        }
        executionLock.lock();
        try {
            return operation.get();
        } finally {
            executionLock.unlock();
        }
    }

    private void requireActive() {
        if (state == SystemState.PAUSED) {
            throw new LendingException(ErrorCode.PAUSED_STATE, "vault is paused");
        }
    }

    private void requireDelegation(String debtor, String delegatee, String asset, BigInteger amount) {
        BigInteger allowance = delegations.getOrDefault(delegationKey(debtor, delegatee, asset), BigInteger.ZERO);
        if (allowance.compareTo(amount) < 0) {
            throw new LendingException(ErrorCode.UNAUTHORIZED,
                    delegatee + " may borrow " + allowance + " of " + asset + " for " + debtor + ", asked " + amount);
        }
    }

    private static String delegationKey(String debtor, String delegatee, String asset) {
        return debtor + "|" + delegatee + "|" + asset;
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LendingException(ErrorCode.ZERO_AMOUNT, "amount must be positive");
        }
    }

    private void publish(String type, String user, String asset, BigInteger amount, String counterparty) {
        events.publish(type, new LedgerActivityEvent(user, asset, amount, counterparty, clock.instant()));
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    /**
     * @param requestId transfer request id when the funds are still in flight, else null
     */
    public record BorrowResult(String debtor, String asset, BigInteger amount, BigInteger fee, String sourceId, String requestId) {
    }

    public record RepayResult(String debtor, String asset, BigInteger paid, BigInteger interestPaid, BigInteger refunded) {
    }

    public record LiquidationResult(String user, String debtAsset, BigInteger debtRepaid, String collateralAsset,
                                    BigInteger collateralSeized) {
    }
}
