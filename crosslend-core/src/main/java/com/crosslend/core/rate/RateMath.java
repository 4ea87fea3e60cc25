package com.crosslend.core.rate;

import java.math.BigInteger;

/**
 * Fixed-point helpers shared by the rate model and the ledger.
 * Rates are per-second WAD values (1e18 = 100% per second).
 */
public final class RateMath {

  public static final BigInteger WAD = BigInteger.TEN.pow(18);
  public static final long SECONDS_PER_YEAR = 31_536_000L;
  public static final long BPS = 10_000L;

  private static final BigInteger BPS_BI = BigInteger.valueOf(BPS);
  private static final BigInteger YEAR_BI = BigInteger.valueOf(SECONDS_PER_YEAR);

  private RateMath() {
  }

  public static BigInteger fromAnnualBps(long annualBps) {
    return BigInteger.valueOf(annualBps).multiply(WAD).divide(BPS_BI).divide(YEAR_BI);
  }

  public static long toAnnualBps(BigInteger ratePerSecond) {
    if (ratePerSecond == null || ratePerSecond.signum() <= 0) {
      return 0L;
    }
    BigInteger bps = ratePerSecond.multiply(YEAR_BI).multiply(BPS_BI);
    BigInteger[] qr = bps.divideAndRemainder(WAD);
    // per-second rates are truncated on the way in, so round half up on the way out
    BigInteger rounded = qr[1].shiftLeft(1).compareTo(WAD) >= 0 ? qr[0].add(BigInteger.ONE) : qr[0];
    return rounded.longValueExact();
  }

  /**
   * borrowed / deposited as a WAD, 0 for an empty pool and capped at 1.
   */
  public static BigInteger utilization(BigInteger totalBorrowed, BigInteger totalDeposited) {
    if (totalDeposited == null || totalDeposited.signum() <= 0 || totalBorrowed == null || totalBorrowed.signum() <= 0) {
      return BigInteger.ZERO;
    }
    BigInteger u = totalBorrowed.multiply(WAD).divide(totalDeposited);
    return u.min(WAD);
  }

  /**
   * Simple interest for {@code elapsedSeconds} at {@code ratePerSecond} on {@code principal}.
   */
  public static BigInteger interest(BigInteger principal, BigInteger ratePerSecond, long elapsedSeconds) {
    if (principal.signum() <= 0 || ratePerSecond.signum() <= 0 || elapsedSeconds <= 0) {
      return BigInteger.ZERO;
    }
    return principal.multiply(ratePerSecond).multiply(BigInteger.valueOf(elapsedSeconds)).divide(WAD);
  }

  public static BigInteger bps(BigInteger amount, long bps) {
    return amount.multiply(BigInteger.valueOf(bps)).divide(BPS_BI);
  }

  public static BigInteger saturatingSub(BigInteger a, BigInteger b) {
    BigInteger r = a.subtract(b);
    return r.signum() < 0 ? BigInteger.ZERO : r;
  }
}
