package com.crosslend.core.oracle;

import com.crosslend.core.config.LendingProperties;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process oracle seeded from {@code lending.assets[*].price-usd}; prices can be pushed at runtime.
 */
@Slf4j
public class StaticPriceOracle implements PriceOracle {

  private static final int USD_SCALE = 18;

  private final Map<String, Quote> quotes = new ConcurrentHashMap<>();

  public StaticPriceOracle(@NonNull List<LendingProperties.Asset> assets) {
    for (LendingProperties.Asset asset : assets) {
      quotes.put(Assets.normalize(asset.address()), new Quote(asset.decimals(), asset.priceUsd()));
    }
  }

  public void addFeed(LendingProperties.Asset asset) {
    String key = Assets.normalize(asset.address());
    if (quotes.putIfAbsent(key, new Quote(asset.decimals(), asset.priceUsd())) != null) {
      throw new LendingException(ErrorCode.ALREADY_REGISTERED, "feed for " + key + " already exists");
    }
    log.info("oracle feed added asset={} symbol={} priceUsd={}", key, asset.symbol(), asset.priceUsd());
  }

  public void setPrice(String asset, BigDecimal priceUsd) {
    String key = Assets.normalize(asset);
    Quote existing = quotes.get(key);
    if (existing == null) {
      throw new LendingException(ErrorCode.ORACLE_UNAVAILABLE, "no feed for " + key);
    }
    quotes.put(key, new Quote(existing.decimals(), priceUsd));
    log.info("oracle price updated asset={} priceUsd={}", key, priceUsd);
  }

  public BigDecimal priceOf(String asset) {
    return require(asset).priceUsd();
  }

  @Override
  public BigDecimal convertToUSD(String asset, BigInteger amount) {
    if (amount == null || amount.signum() == 0) {
      return BigDecimal.ZERO;
    }
    Quote quote = require(asset);
    return new BigDecimal(amount)
        .movePointLeft(quote.decimals())
        .multiply(quote.priceUsd())
        .setScale(USD_SCALE, RoundingMode.DOWN);
  }

  @Override
  public BigInteger convertUSDToAsset(BigDecimal usdValue, String asset) {
    if (usdValue == null || usdValue.signum() <= 0) {
      return BigInteger.ZERO;
    }
    Quote quote = require(asset);
    if (quote.priceUsd().signum() <= 0) {
      throw new LendingException(ErrorCode.ORACLE_UNAVAILABLE, "zero price for " + asset);
    }
    return usdValue
        .divide(quote.priceUsd(), USD_SCALE + quote.decimals(), RoundingMode.DOWN)
        .movePointRight(quote.decimals())
        .setScale(0, RoundingMode.DOWN)
        .toBigIntegerExact();
  }

  private Quote require(String asset) {
    Quote quote = quotes.get(asset);
    if (quote == null) {
      throw new LendingException(ErrorCode.ORACLE_UNAVAILABLE, "no feed for " + asset);
    }
    return quote;
  }

  private record Quote(int decimals, BigDecimal priceUsd) {
  }
}
