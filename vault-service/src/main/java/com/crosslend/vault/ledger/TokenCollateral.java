package com.crosslend.vault.ledger;

import com.crosslend.core.domain.RateMode;
import com.crosslend.core.rate.RateMath;
import lombok.Getter;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One user's balance sheet in one asset. {@code borrowed} is principal plus accrued interest;
 * principal is kept per funding source so repayments can be returned to the pool that lent them.
 * {@code inFlight} is principal whose cross-chain delivery is still pending; it accrues no interest.
 */
@Getter
public class TokenCollateral {

    private final String asset;
    private BigInteger deposited = BigInteger.ZERO;
    private BigInteger borrowed = BigInteger.ZERO;
    private final Map<String, BigInteger> principalBySource = new LinkedHashMap<>();
    private BigInteger inFlight = BigInteger.ZERO;
    private RateMode rateMode = RateMode.VARIABLE;
    private BigInteger stableRatePerSecond = BigInteger.ZERO;
    private Instant stableLockedUntil;
    private Instant lastUpdate;

    TokenCollateral(String asset, Instant createdAt) {
        this.asset = asset;
        this.lastUpdate = createdAt;
    }

    public Map<String, BigInteger> getPrincipalBySource() {
        return Collections.unmodifiableMap(principalBySource);
    }

    public BigInteger principal() {
        return principalBySource.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    public BigInteger principalFrom(String sourceId) {
        return principalBySource.getOrDefault(sourceId, BigInteger.ZERO);
    }

    public BigInteger accruedInterest() {
        BigInteger interest = borrowed.subtract(principal());
        return interest.signum() < 0 ? BigInteger.ZERO : interest;
    }

    public boolean hasDebt() {
        return borrowed.signum() > 0;
    }

    public BigInteger accruingDebt() {
        return RateMath.saturatingSub(borrowed, inFlight);
    }

    void addDeposit(BigInteger amount) {
        deposited = deposited.add(amount);
    }

    void removeDeposit(BigInteger amount) {
        deposited = deposited.subtract(amount);
    }

    void addInterest(BigInteger interest) {
        borrowed = borrowed.add(interest);
    }

    void addPrincipal(String sourceId, BigInteger amount) {
        principalBySource.merge(sourceId, amount, BigInteger::add);
        borrowed = borrowed.add(amount);
    }

    /**
     * @return the amount actually removed, at most what the source lent
     */
    BigInteger removePrincipal(String sourceId, BigInteger amount) {
        BigInteger held = principalFrom(sourceId);
        BigInteger removed = held.min(amount);
        if (removed.signum() <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger left = held.subtract(removed);
        if (left.signum() == 0) {
            principalBySource.remove(sourceId);
        } else {
            principalBySource.put(sourceId, left);
        }
        borrowed = borrowed.subtract(removed);
        return removed;
    }

    void lockInFlight(BigInteger amount) {
        inFlight = inFlight.add(amount);
    }

    void releaseInFlight(BigInteger amount) {
        inFlight = RateMath.saturatingSub(inFlight, amount);
    }

    BigInteger removeInterest(BigInteger amount) {
        BigInteger removed = accruedInterest().min(amount);
        borrowed = borrowed.subtract(removed);
        return removed;
    }

    void useVariableRate() {
        rateMode = RateMode.VARIABLE;
        stableRatePerSecond = BigInteger.ZERO;
        stableLockedUntil = null;
    }

    void lockStableRate(BigInteger ratePerSecond, Instant lockedUntil) {
        rateMode = RateMode.STABLE;
        stableRatePerSecond = ratePerSecond;
        stableLockedUntil = lockedUntil;
    }

    void touch(Instant now) {
        lastUpdate = now;
    }
}
