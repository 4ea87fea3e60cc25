package com.crosslend.core.rate;

import java.math.BigInteger;

/**
 * Maps pool utilization to a borrow rate. Implementations must be stateless, deterministic and
 * monotonic non-decreasing in utilization.
 */
public interface InterestRateModel {

  /**
   * @param utilizationWad totalBorrowed / totalDeposited as a WAD, in [0, 1e18]
   * @return per-second variable borrow rate as a WAD
   */
  BigInteger ratePerSecond(BigInteger utilizationWad);

  /**
   * Per-second rate locked into a STABLE position opened at this utilization.
   */
  BigInteger stableRatePerSecond(BigInteger utilizationWad);

  default long annualRateBps(BigInteger utilizationWad) {
    return RateMath.toAnnualBps(ratePerSecond(utilizationWad));
  }
}
