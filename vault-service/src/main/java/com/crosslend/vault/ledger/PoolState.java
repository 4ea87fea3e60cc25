package com.crosslend.vault.ledger;

import com.crosslend.core.rate.RateMath;
import lombok.Getter;

import java.math.BigInteger;

/**
 * Pool-wide counters for one asset. {@code totalBorrowed} counts principal lent from this pool only;
 * interest and fees land in {@code reserves}. Every subtraction saturates at zero.
 */
@Getter
public class PoolState {

    private final String asset;
    private BigInteger totalDeposited = BigInteger.ZERO;
    private BigInteger totalBorrowed = BigInteger.ZERO;
    private BigInteger reserves = BigInteger.ZERO;

    PoolState(String asset) {
        this.asset = asset;
    }

    public BigInteger available() {
        return RateMath.saturatingSub(totalDeposited, totalBorrowed);
    }

    public BigInteger utilization() {
        return RateMath.utilization(totalBorrowed, totalDeposited);
    }

    void deposit(BigInteger amount) {
        totalDeposited = totalDeposited.add(amount);
    }

    void withdraw(BigInteger amount) {
        totalDeposited = RateMath.saturatingSub(totalDeposited, amount);
    }

    void lend(BigInteger amount) {
        totalBorrowed = totalBorrowed.add(amount);
    }

    void repaid(BigInteger amount) {
        totalBorrowed = RateMath.saturatingSub(totalBorrowed, amount);
    }

    void addReserves(BigInteger amount) {
        reserves = reserves.add(amount);
    }

    public PoolSnapshot snapshot() {
        return new PoolSnapshot(asset, totalDeposited, totalBorrowed, reserves, utilization());
    }

    public record PoolSnapshot(
            String asset,
            BigInteger totalDeposited,
            BigInteger totalBorrowed,
            BigInteger reserves,
            BigInteger utilizationWad
    ) {
    }
}
