package com.crosslend.core.domain;

import java.math.BigInteger;

/**
 * A source's offer for one borrow request. Computed on demand, never persisted.
 *
 * @param sourceId          registration key of the quoting source inside the router
 * @param availableAmount   what the source can fund right now, capped at the requested amount
 * @param feeBps            upfront fee in basis points
 * @param settlementSeconds estimated time until the recipient holds the funds
 * @param annualRateBps     annualized borrow rate the source charges
 */
public record LiquidityQuote(
    String sourceId,
    LiquiditySourceType sourceType,
    String sourceAddress,
    long originChainId,
    String asset,
    BigInteger requestedAmount,
    BigInteger availableAmount,
    long feeBps,
    long settlementSeconds,
    long annualRateBps
) {

  public boolean isEmpty() {
    return availableAmount == null || availableAmount.signum() <= 0;
  }

  public boolean coversRequest() {
    return !isEmpty() && availableAmount.compareTo(requestedAmount) >= 0;
  }

  public BigInteger feeAmount() {
    return availableAmount.multiply(BigInteger.valueOf(feeBps)).divide(BigInteger.valueOf(10_000L));
  }
}
