package com.crosslend.core.oracle;

import com.crosslend.core.config.LendingProperties;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StaticPriceOracleTest {

  private static final String USDC = "0x3c499c542cef5e3811e1192ce70d8cc03d5c3359";

  private final StaticPriceOracle oracle = new StaticPriceOracle(List.of(
      new LendingProperties.Asset(null, "ETH", 18, new BigDecimal("2000")),
      new LendingProperties.Asset(USDC, "USDC", 6, BigDecimal.ONE)
  ));

  @Test
  void convertsBaseUnitsToUsd() {
    BigInteger tenEth = BigInteger.TEN.pow(19);

    assertThat(oracle.convertToUSD(Assets.NATIVE, tenEth)).isEqualByComparingTo("20000");
    assertThat(oracle.convertToUSD(USDC, BigInteger.valueOf(2_500_000))).isEqualByComparingTo("2.5");
  }

  @Test
  void convertsUsdBackToBaseUnitsRoundingDown() {
    assertThat(oracle.convertUSDToAsset(new BigDecimal("3000"), Assets.NATIVE))
        .isEqualTo(new BigInteger("1500000000000000000"));
    assertThat(oracle.convertUSDToAsset(new BigDecimal("1.0000009"), USDC)).isEqualTo(BigInteger.valueOf(1_000_000));
  }

  @Test
  void priceUpdatesApplyToLaterConversions() {
    oracle.setPrice(Assets.NATIVE, new BigDecimal("1000"));

    assertThat(oracle.convertToUSD(Assets.NATIVE, BigInteger.TEN.pow(18))).isEqualByComparingTo("1000");
  }

  @Test
  void unknownAssetIsAnExternalFailure() {
    assertThatThrownBy(() -> oracle.convertToUSD("0x00000000000000000000000000000000000000ff", BigInteger.ONE))
        .isInstanceOf(LendingException.class)
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.ORACLE_UNAVAILABLE));
  }
}
