package com.crosslend.vault.ledger;

import com.crosslend.core.domain.RateMode;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import com.crosslend.core.oracle.PriceOracle;
import com.crosslend.core.rate.InterestRateModel;
import com.crosslend.core.rate.RateMath;
import com.crosslend.vault.HealthFactor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Positions, pool counters and interest accrual.
 * <p>
 * Not thread-safe on its own: callers hold the vault's execution lock around every mutation.
 * Balance checks that depend on the funding source live in the liquidity layer; this class only
 * keeps the books consistent.
 */
@Slf4j
public class CollateralLedger {

    public static final String LOCAL_SOURCE = "local-vault";

    private final InterestRateModel rateModel;
    private final PriceOracle oracle;
    private final Clock clock;
    private final Duration stableRateLock;

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final Map<String, PoolState> pools = new ConcurrentHashMap<>();

    public CollateralLedger(
            @NonNull InterestRateModel rateModel,
            @NonNull PriceOracle oracle,
            @NonNull Clock clock,
            @NonNull Duration stableRateLock
    ) {
        this.rateModel = rateModel;
        this.oracle = oracle;
        this.clock = clock;
        this.stableRateLock = stableRateLock;
    }

    public Optional<Position> position(String user) {
        return Optional.ofNullable(positions.get(user));
    }

    public PoolState pool(String asset) {
        return pools.computeIfAbsent(asset, PoolState::new);
    }

    public List<PoolState.PoolSnapshot> pools() {
        return pools.values().stream().map(PoolState::snapshot).toList();
    }

    public BigInteger deposited(String user, String asset) {
        return position(user).flatMap(p -> p.find(asset)).map(TokenCollateral::getDeposited).orElse(BigInteger.ZERO);
    }

    public BigInteger debt(String user, String asset) {
        return position(user).flatMap(p -> p.find(asset)).map(TokenCollateral::getBorrowed).orElse(BigInteger.ZERO);
    }

    public void recordDeposit(String user, String asset, BigInteger amount) {
        Instant now = clock.instant();
        positionOf(user, now).slot(asset, now).addDeposit(amount);
        pool(asset).deposit(amount);
    }

    public void recordWithdrawal(String user, String asset, BigInteger amount) {
        Instant now = clock.instant();
        TokenCollateral slot = positionOf(user, now).slot(asset, now);
        if (slot.getDeposited().compareTo(amount) < 0) {
            throw new LendingException(ErrorCode.INSUFFICIENT_COLLATERAL,
                    user + " has " + slot.getDeposited() + " of " + asset + ", cannot withdraw " + amount);
        }
        PoolState pool = pool(asset);
        if (pool.getTotalDeposited().subtract(amount).compareTo(pool.getTotalBorrowed()) < 0) {
            throw new LendingException(ErrorCode.INSUFFICIENT_LIQUIDITY,
                    "withdrawing " + amount + " of " + asset + " would leave the pool below its borrowed total");
        }
        slot.removeDeposit(amount);
        pool.withdraw(amount);
    }

    /**
     * Brings one debt up to date. A second call in the same instant changes nothing.
     *
     * @return interest added
     */
    public BigInteger accrueInterest(String user, String asset) {
        Position position = positions.get(user);
        if (position == null) {
            return BigInteger.ZERO;
        }
        Optional<TokenCollateral> found = position.find(asset);
        if (found.isEmpty()) {
            return BigInteger.ZERO;
        }
        TokenCollateral slot = found.get();
        Instant now = clock.instant();
        long elapsed = Duration.between(slot.getLastUpdate(), now).getSeconds();
        if (elapsed <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger interest = BigInteger.ZERO;
        if (slot.hasDebt()) {
            BigInteger rate = slot.getRateMode() == RateMode.STABLE
                    ? slot.getStableRatePerSecond()
                    : rateModel.ratePerSecond(pool(asset).utilization());
            interest = RateMath.interest(slot.accruingDebt(), rate, elapsed);
            slot.addInterest(interest);
            if (slot.getRateMode() == RateMode.STABLE && !now.isBefore(slot.getStableLockedUntil())) {
                lockStable(slot, asset, now);
                log.debug("stable rate re-snapshotted user={} asset={} rate={}", user, asset, slot.getStableRatePerSecond());
            }
        }
        slot.touch(now);
        revalue(position, now);
        return interest;
    }

    public void accrueAll(String user) {
        position(user).ifPresent(p -> p.slots().forEach(slot -> accrueInterest(user, slot.getAsset())));
    }

    /**
     * Books new debt funded by {@code sourceId}. Pool counters for the local source are moved by the
     * local liquidity source itself.
     */
    public void recordBorrow(String user, String asset, String sourceId, BigInteger amount, RateMode rateMode) {
        recordBorrow(user, asset, sourceId, amount, rateMode, false);
    }

    /**
     * @param inFlight the funds are still being delivered; the debt accrues nothing until
     *                 {@link #settleInFlight} or {@link #rollbackBorrow}
     */
    public void recordBorrow(String user, String asset, String sourceId, BigInteger amount, RateMode rateMode,
                             boolean inFlight) {
        Instant now = clock.instant();
        Position position = positionOf(user, now);
        TokenCollateral slot = position.slot(asset, now);
        applyRateMode(slot, asset, rateMode, now);
        slot.addPrincipal(sourceId, amount);
        if (inFlight) {
            slot.lockInFlight(amount);
        }
        slot.touch(now);
        revalue(position, now);
    }

    /**
     * The in-flight funds arrived: the debt starts accruing from now.
     */
    public void settleInFlight(String user, String asset, BigInteger amount) {
        Position position = positions.get(user);
        if (position == null) {
            return;
        }
        accrueInterest(user, asset);
        position.slot(asset, clock.instant()).releaseInFlight(amount);
    }

    /**
     * Reverses an optimistic borrow whose funds never arrived.
     */
    public BigInteger rollbackBorrow(String user, String asset, String sourceId, BigInteger amount) {
        Position position = positions.get(user);
        if (position == null) {
            return BigInteger.ZERO;
        }
        accrueInterest(user, asset);
        Instant now = clock.instant();
        TokenCollateral slot = position.slot(asset, now);
        BigInteger removed = slot.removePrincipal(sourceId, amount);
        slot.releaseInFlight(amount);
        revalue(position, now);
        return removed;
    }

    /**
     * Splits a payment into interest, then local principal, then the principal of each other source
     * in {@code sourceOrder}. {@code locked} principal (funds still in flight) is not repayable.
     */
    public Repayment applyRepayment(String user, String asset, BigInteger amount, List<String> sourceOrder,
                                    Map<String, BigInteger> locked) {
        Position position = positions.get(user);
        if (position == null) {
            return Repayment.none();
        }
        Instant now = clock.instant();
        TokenCollateral slot = position.slot(asset, now);
        BigInteger remaining = amount;

        BigInteger interest = slot.removeInterest(remaining);
        remaining = remaining.subtract(interest);
        if (interest.signum() > 0) {
            pool(asset).addReserves(interest);
        }

        Map<String, BigInteger> principal = new LinkedHashMap<>();
        BigInteger local = slot.removePrincipal(LOCAL_SOURCE, remaining);
        remaining = remaining.subtract(local);
        if (local.signum() > 0) {
            principal.put(LOCAL_SOURCE, local);
        }
        for (String sourceId : sourceOrder) {
            if (remaining.signum() <= 0) {
                break;
            }
            if (LOCAL_SOURCE.equals(sourceId)) {
                continue;
            }
            BigInteger repayable = RateMath.saturatingSub(slot.principalFrom(sourceId), locked.getOrDefault(sourceId, BigInteger.ZERO));
            BigInteger paid = slot.removePrincipal(sourceId, remaining.min(repayable));
            if (paid.signum() > 0) {
                principal.put(sourceId, paid);
                remaining = remaining.subtract(paid);
            }
        }
        slot.touch(now);
        revalue(position, now);
        return new Repayment(interest, principal);
    }

    public void lendLocal(String asset, BigInteger amount) {
        PoolState pool = pool(asset);
        if (pool.available().compareTo(amount) < 0) {
            throw new LendingException(ErrorCode.INSUFFICIENT_LIQUIDITY,
                    "pool " + asset + " has " + pool.available() + " available, asked " + amount);
        }
        pool.lend(amount);
    }

    public void returnLocal(String asset, BigInteger amount) {
        pool(asset).repaid(amount);
    }

    public void addReserves(String asset, BigInteger amount) {
        pool(asset).addReserves(amount);
    }

    /**
     * Moves seized collateral out of the user's balance and the pool.
     */
    public void seizeCollateral(String user, String asset, BigInteger amount) {
        recordWithdrawal(user, asset, amount);
    }

    public void switchRateMode(String user, String asset, RateMode mode) {
        Instant now = clock.instant();
        Position position = positionOf(user, now);
        applyRateMode(position.slot(asset, now), asset, mode, now);
    }

    public HealthFactor healthFactor(String user) {
        return prospectiveHealthFactor(user, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    /**
     * Health factor after removing {@code collateralUsdDelta} of collateral and adding
     * {@code debtUsdDelta} of debt.
     */
    public HealthFactor prospectiveHealthFactor(String user, BigDecimal collateralUsdDelta, BigDecimal debtUsdDelta) {
        Position position = positions.get(user);
        BigDecimal collateral = BigDecimal.ZERO;
        BigDecimal borrowed = BigDecimal.ZERO;
        if (position != null) {
            for (TokenCollateral slot : position.slots()) {
                collateral = collateral.add(oracle.convertToUSD(slot.getAsset(), slot.getDeposited()));
                borrowed = borrowed.add(oracle.convertToUSD(slot.getAsset(), slot.getBorrowed()));
            }
        }
        return HealthFactor.of(collateral.subtract(collateralUsdDelta), borrowed.add(debtUsdDelta));
    }

    public BigDecimal valueOf(String asset, BigInteger amount) {
        return oracle.convertToUSD(asset, amount);
    }

    public BigInteger amountFor(BigDecimal usd, String asset) {
        return oracle.convertUSDToAsset(usd, asset);
    }

    public long variableRateBps(String asset) {
        return rateModel.annualRateBps(pool(asset).utilization());
    }

    private void applyRateMode(TokenCollateral slot, String asset, RateMode mode, Instant now) {
        if (mode == null || mode == slot.getRateMode() && slot.hasDebt()) {
            return;
        }
        if (mode == RateMode.STABLE) {
            lockStable(slot, asset, now);
        } else {
            slot.useVariableRate();
        }
    }

    private void lockStable(TokenCollateral slot, String asset, Instant now) {
        slot.lockStableRate(rateModel.stableRatePerSecond(pool(asset).utilization()), now.plus(stableRateLock));
    }

    private Position positionOf(String user, Instant now) {
        return positions.computeIfAbsent(user, u -> new Position(u, now));
    }

    private void revalue(Position position, Instant now) {
        BigDecimal borrowed = BigDecimal.ZERO;
        for (TokenCollateral slot : position.slots()) {
            if (slot.hasDebt()) {
                borrowed = borrowed.add(oracle.convertToUSD(slot.getAsset(), slot.getBorrowed()));
            }
        }
        position.revalued(borrowed, now);
    }

    /**
     * @param principal principal repaid per funding source, local first
     */
    public record Repayment(BigInteger interest, Map<String, BigInteger> principal) {

        static Repayment none() {
            return new Repayment(BigInteger.ZERO, Map.of());
        }

        public BigInteger total() {
            return principal.values().stream().reduce(interest, BigInteger::add);
        }
    }
}
