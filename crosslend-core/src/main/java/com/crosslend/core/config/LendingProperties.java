package com.crosslend.core.config;

import com.crosslend.core.compliance.ComplianceMode;
import com.crosslend.core.domain.ExecutionMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix = "lending")
public record LendingProperties(
    ExecutionMode mode,
    @Valid Chain chain,
    List<@Valid Asset> assets,
    @Valid Rates rates,
    @Valid Risk risk,
    @Valid FlashLoan flashLoan,
    @Valid Compliance compliance,
    @Valid Router router,
    @Valid Transfers transfers,
    @Valid Admin admin,
    List<@Valid RemoteChain> remoteChains,
    @Valid MoneyMarket moneyMarket
) {

  public LendingProperties {
    if (mode == null) {
      mode = ExecutionMode.PAPER;
    }
    if (chain == null) {
      chain = new Chain(null, null, null);
    }
    if (assets == null || assets.isEmpty()) {
      assets = List.of(new Asset(null, "ETH", 18, new BigDecimal("2000")));
    }
    if (rates == null) {
      rates = new Rates(null, null, null, null, null, null);
    }
    if (risk == null) {
      risk = new Risk(null, null, null);
    }
    if (flashLoan == null) {
      flashLoan = new FlashLoan(null, null);
    }
    if (compliance == null) {
      compliance = new Compliance(null, null, null, null);
    }
    if (router == null) {
      router = new Router(null);
    }
    if (transfers == null) {
      transfers = new Transfers(null, null);
    }
    if (admin == null) {
      admin = new Admin(null, null);
    }
    remoteChains = remoteChains == null ? List.of() : List.copyOf(remoteChains);
    if (moneyMarket == null) {
      moneyMarket = new MoneyMarket(false, null, null, null, null, null);
    }
  }

  private static List<String> sanitizeStringList(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  public record Chain(
      @Min(1) Long chainId,
      String name,
      /**
       * Custody account of the vault on this chain.
       */
      String vaultAddress
  ) {
    public Chain {
      if (chainId == null) {
        chainId = 1L;
      }
      if (name == null || name.isBlank()) {
        name = "ethereum";
      }
      if (vaultAddress == null || vaultAddress.isBlank()) {
        vaultAddress = "0x00000000000000000000000000000000000c0de1";
      }
    }
  }

  public record Asset(
      /**
       * Token address; blank means the native asset.
       */
      String address,
      @NotNull String symbol,
      @Min(0) @Max(36) Integer decimals,
      @NotNull @DecimalMin("0.0") BigDecimal priceUsd
  ) {
    public Asset {
      if (address == null || address.isBlank()) {
        address = "0x0000000000000000000000000000000000000000";
      }
      if (decimals == null) {
        decimals = 18;
      }
    }
  }

  /**
   * Kinked rate curve; every figure is an annual rate in basis points.
   */
  public record Rates(
      @PositiveOrZero Long baseRateBps,
      @PositiveOrZero Long slope1Bps,
      @PositiveOrZero Long slope2Bps,
      @Min(1) @Max(10_000) Long optimalUtilizationBps,
      @PositiveOrZero Long stablePremiumBps,
      Duration stableRateLock
  ) {
    public Rates {
      if (baseRateBps == null) {
        baseRateBps = 200L;
      }
      if (slope1Bps == null) {
        slope1Bps = 400L;
      }
      if (slope2Bps == null) {
        slope2Bps = 7_500L;
      }
      if (optimalUtilizationBps == null) {
        optimalUtilizationBps = 8_000L;
      }
      if (stablePremiumBps == null) {
        stablePremiumBps = 200L;
      }
      if (stableRateLock == null) {
        stableRateLock = Duration.ofDays(30);
      }
    }
  }

  public record Risk(
      /**
       * Health factor (percentage points) a borrow or withdraw must leave behind. 100 = break-even.
       */
      @DecimalMin("0.0") BigDecimal minHealthFactor,
      /**
       * Positions strictly below this health factor may be liquidated.
       */
      @DecimalMin("0.0") BigDecimal liquidationThreshold,
      @PositiveOrZero @Max(10_000) Long liquidationPenaltyBps
  ) {
    public Risk {
      if (minHealthFactor == null) {
        minHealthFactor = BigDecimal.valueOf(100);
      }
      if (liquidationThreshold == null) {
        liquidationThreshold = BigDecimal.valueOf(100);
      }
      if (liquidationPenaltyBps == null) {
        liquidationPenaltyBps = 500L;
      }
    }
  }

  public record FlashLoan(
      Boolean enabled,
      @PositiveOrZero @Max(10_000) Long feeBps
  ) {
    public FlashLoan {
      if (enabled == null) {
        enabled = true;
      }
      if (feeBps == null) {
        feeBps = 9L;
      }
    }
  }

  public record Compliance(
      ComplianceMode mode,
      /**
       * Claim topic required in RESTRICTIVE mode; null means verification alone is enough.
       */
      Long claimTopic,
      List<String> verifiedAddresses,
      /**
       * Claim topic to holder addresses, for the in-process gate.
       */
      Map<String, List<String>> claimHolders
  ) {
    public Compliance {
      if (mode == null) {
        mode = ComplianceMode.PERMISSIVE;
      }
      verifiedAddresses = sanitizeStringList(verifiedAddresses);
      claimHolders = claimHolders == null ? Map.of() : Map.copyOf(claimHolders);
    }
  }

  public record Router(
      /**
       * Holding period used to turn a source's annual rate into an opportunity cost.
       */
      Duration expectedHoldingPeriod
  ) {
    public Router {
      if (expectedHoldingPeriod == null || expectedHoldingPeriod.isNegative()) {
        expectedHoldingPeriod = Duration.ofDays(30);
      }
    }
  }

  public record Transfers(
      /**
       * PENDING transfers older than this are forced to FAILED by the sweep.
       */
      Duration timeout,
      @Min(100) Long sweepIntervalMillis
  ) {
    public Transfers {
      if (timeout == null || timeout.isZero() || timeout.isNegative()) {
        timeout = Duration.ofHours(1);
      }
      if (sweepIntervalMillis == null) {
        sweepIntervalMillis = 60_000L;
      }
    }
  }

  public record Admin(
      String owner,
      List<String> completionCallers
  ) {
    public Admin {
      if (owner == null || owner.isBlank()) {
        owner = "0x00000000000000000000000000000000000000a1";
      }
      completionCallers = sanitizeStringList(completionCallers);
    }
  }

  public record RemoteChain(
      @NotNull String name,
      @NotNull @Min(1) Long chainId,
      @NotNull String vaultAddress,
      @PositiveOrZero Long feeBps,
      @PositiveOrZero Long settlementSeconds,
      @PositiveOrZero Long annualRateBps,
      /**
       * Initially reported liquidity per asset symbol, in base units.
       */
      Map<String, BigInteger> liquidity
  ) {
    public RemoteChain {
      if (feeBps == null) {
        feeBps = 10L;
      }
      if (settlementSeconds == null) {
        settlementSeconds = 180L;
      }
      if (annualRateBps == null) {
        annualRateBps = 0L;
      }
      liquidity = liquidity == null ? Map.of() : Map.copyOf(liquidity);
    }
  }

  public record MoneyMarket(
      boolean enabled,
      String name,
      String address,
      @PositiveOrZero Long annualRateBps,
      @PositiveOrZero Long settlementSeconds,
      /**
       * Liquidity per asset symbol, in base units.
       */
      Map<String, BigInteger> liquidity
  ) {
    public MoneyMarket {
      if (name == null || name.isBlank()) {
        name = "external-market";
      }
      if (address == null || address.isBlank()) {
        address = "0x00000000000000000000000000000000000aa7e0";
      }
      if (annualRateBps == null) {
        annualRateBps = 450L;
      }
      if (settlementSeconds == null) {
        settlementSeconds = 15L;
      }
      liquidity = liquidity == null ? Map.of() : Map.copyOf(liquidity);
    }
  }
}
