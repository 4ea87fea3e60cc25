package com.crosslend.core.oracle;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * External price source. Values may be stale; callers must not assume atomicity with on-chain
 * price movement.
 */
public interface PriceOracle {

  /**
   * @param amount base units of {@code asset}
   * @return USD value
   */
  BigDecimal convertToUSD(String asset, BigInteger amount);

  /**
   * @return base units of {@code asset} worth {@code usdValue}, rounded down
   */
  BigInteger convertUSDToAsset(BigDecimal usdValue, String asset);
}
