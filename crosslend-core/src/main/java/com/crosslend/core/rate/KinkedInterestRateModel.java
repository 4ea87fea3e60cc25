package com.crosslend.core.rate;

import com.crosslend.core.config.LendingProperties;
import lombok.NonNull;

import java.math.BigInteger;

/**
 * Two-slope curve: {@code base + slope1 * u / optimal} up to the optimal utilization, then
 * {@code base + slope1 + slope2 * (u - optimal) / (1 - optimal)}.
 */
public final class KinkedInterestRateModel implements InterestRateModel {

  private final long baseRateBps;
  private final long slope1Bps;
  private final long slope2Bps;
  private final BigInteger optimalUtilization;
  private final long stablePremiumBps;

  public KinkedInterestRateModel(long baseRateBps, long slope1Bps, long slope2Bps, long optimalUtilizationBps,
                                 long stablePremiumBps) {
    if (baseRateBps < 0 || slope1Bps < 0 || slope2Bps < 0 || stablePremiumBps < 0) {
      throw new IllegalArgumentException("rate parameters must be >= 0");
    }
    if (optimalUtilizationBps <= 0 || optimalUtilizationBps > RateMath.BPS) {
      throw new IllegalArgumentException("optimalUtilizationBps must be in (0, 10000]: " + optimalUtilizationBps);
    }
    this.baseRateBps = baseRateBps;
    this.slope1Bps = slope1Bps;
    this.slope2Bps = slope2Bps;
    this.optimalUtilization = BigInteger.valueOf(optimalUtilizationBps).multiply(RateMath.WAD)
        .divide(BigInteger.valueOf(RateMath.BPS));
    this.stablePremiumBps = stablePremiumBps;
  }

  public static KinkedInterestRateModel from(@NonNull LendingProperties.Rates rates) {
    return new KinkedInterestRateModel(
        rates.baseRateBps(),
        rates.slope1Bps(),
        rates.slope2Bps(),
        rates.optimalUtilizationBps(),
        rates.stablePremiumBps()
    );
  }

  @Override
  public BigInteger ratePerSecond(BigInteger utilizationWad) {
    return RateMath.fromAnnualBps(annualBps(utilizationWad));
  }

  @Override
  public BigInteger stableRatePerSecond(BigInteger utilizationWad) {
    return RateMath.fromAnnualBps(annualBps(utilizationWad) + stablePremiumBps);
  }

  private long annualBps(BigInteger utilizationWad) {
    BigInteger u = utilizationWad == null ? BigInteger.ZERO : utilizationWad.max(BigInteger.ZERO).min(RateMath.WAD);
    if (u.compareTo(optimalUtilization) <= 0) {
      long slope = BigInteger.valueOf(slope1Bps).multiply(u).divide(optimalUtilization).longValueExact();
      return baseRateBps + slope;
    }
    BigInteger excess = u.subtract(optimalUtilization);
    BigInteger headroom = RateMath.WAD.subtract(optimalUtilization);
    long steep = headroom.signum() == 0
        ? slope2Bps
        : BigInteger.valueOf(slope2Bps).multiply(excess).divide(headroom).longValueExact();
    return baseRateBps + slope1Bps + steep;
  }
}
