package com.crosslend.bridge.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "bridge")
public record BridgeProperties(
    @Valid Onchain onchain,
    @Valid Retry retry,
    @Valid Local local,
    @Valid Ccip ccip,
    @Valid Axelar axelar,
    @Valid Relay relay,
    @Valid MoneyMarket moneyMarket,
    /**
     * Chain name to protocol name, applied at startup.
     */
    Map<String, String> preferred
) {

  public BridgeProperties {
    if (onchain == null) {
      onchain = new Onchain(null, null, null, null, null, null, null, null);
    }
    if (retry == null) {
      retry = new Retry(null, null, null, null);
    }
    if (local == null) {
      local = new Local(null);
    }
    if (ccip == null) {
      ccip = new Ccip(null, null, null, null, null, null, null);
    }
    if (axelar == null) {
      axelar = new Axelar(null, null, null, null, null, null);
    }
    if (relay == null) {
      relay = new Relay(null, null, null, null, null);
    }
    if (moneyMarket == null) {
      moneyMarket = new MoneyMarket(null, null, null);
    }
    preferred = preferred == null ? Map.of() : Map.copyOf(preferred);
  }

  public record Onchain(
      /**
       * JSON-RPC endpoint of the source chain, used only in LIVE mode.
       */
      URI rpcUrl,
      @Min(1) Long chainId,
      String signerPrivateKey,
      @Min(21_000) Long fallbackGasLimit,
      @DecimalMin("0.0") Double gasLimitMultiplier,
      @DecimalMin("0.0") Double gasPriceMultiplier,
      @Min(100) Long receiptPollIntervalMillis,
      @Min(1) Integer receiptPollAttempts
  ) {
    public Onchain {
      if (rpcUrl == null) {
        rpcUrl = URI.create("http://localhost:8545");
      }
      if (chainId == null) {
        chainId = 1L;
      }
      if (fallbackGasLimit == null) {
        fallbackGasLimit = 500_000L;
      }
      if (gasLimitMultiplier == null) {
        gasLimitMultiplier = 1.25;
      }
      if (gasPriceMultiplier == null) {
        gasPriceMultiplier = 1.10;
      }
      if (receiptPollIntervalMillis == null) {
        receiptPollIntervalMillis = 1_000L;
      }
      if (receiptPollAttempts == null) {
        receiptPollAttempts = 60;
      }
    }
  }

  public record Retry(
      Boolean enabled,
      @Min(1) Integer maxAttempts,
      @PositiveOrZero Long initialBackoffMillis,
      @PositiveOrZero Long maxBackoffMillis
  ) {
    public Retry {
      if (enabled == null) {
        enabled = true;
      }
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 250L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 2_000L;
      }
    }
  }

  public record Local(Boolean enabled) {
    public Local {
      if (enabled == null) {
        enabled = true;
      }
    }
  }

  /**
   * Chainlink CCIP. Chains are addressed by unsigned 64-bit selectors.
   */
  public record Ccip(
      Boolean enabled,
      String routerAddress,
      @PositiveOrZero Long gasLimit,
      @NotNull BigInteger baseFeeWei,
      @NotNull BigInteger feePerByteWei,
      Integer protocolVersion,
      /**
       * Chain name to decimal chain selector.
       */
      Map<String, String> selectors
  ) {
    public Ccip {
      if (enabled == null) {
        enabled = true;
      }
      if (routerAddress == null || routerAddress.isBlank()) {
        routerAddress = "0x80226fc0ee2b096224eeac085bb9a8cba1146f7d";
      }
      if (gasLimit == null) {
        gasLimit = 200_000L;
      }
      if (baseFeeWei == null) {
        baseFeeWei = new BigInteger("100000000000000");
      }
      if (feePerByteWei == null) {
        feePerByteWei = new BigInteger("1000000000");
      }
      if (protocolVersion == null) {
        protocolVersion = 1;
      }
      if (selectors == null || selectors.isEmpty()) {
        selectors = defaultCcipSelectors();
      }
    }
  }

  /**
   * Axelar GMP. Chains are addressed by Axelar's chain-name strings.
   */
  public record Axelar(
      Boolean enabled,
      String gatewayAddress,
      String gasServiceAddress,
      @NotNull BigInteger baseFeeWei,
      @NotNull BigInteger feePerByteWei,
      /**
       * Chain name to Axelar chain identifier.
       */
      Map<String, String> chains
  ) {
    public Axelar {
      if (enabled == null) {
        enabled = true;
      }
      if (gatewayAddress == null || gatewayAddress.isBlank()) {
        gatewayAddress = "0x4f4495243837681061c4743b74b3eedf548d56a5";
      }
      if (gasServiceAddress == null || gasServiceAddress.isBlank()) {
        gasServiceAddress = "0x2d5d7d31f671f86c782533cc367f14109a082712";
      }
      if (baseFeeWei == null) {
        baseFeeWei = new BigInteger("150000000000000");
      }
      if (feePerByteWei == null) {
        feePerByteWei = new BigInteger("1500000000");
      }
      if (chains == null || chains.isEmpty()) {
        chains = defaultAxelarChains();
      }
    }
  }

  /**
   * Endpoint-style message relay. Chains are addressed by 32-bit endpoint ids.
   */
  public record Relay(
      Boolean enabled,
      String endpointAddress,
      @NotNull BigInteger baseFeeWei,
      @NotNull BigInteger feePerByteWei,
      Map<String, Long> endpoints
  ) {
    public Relay {
      if (enabled == null) {
        enabled = true;
      }
      if (endpointAddress == null || endpointAddress.isBlank()) {
        endpointAddress = "0x1a44076050125825900e736c501f859c50fe728c";
      }
      if (baseFeeWei == null) {
        baseFeeWei = new BigInteger("80000000000000");
      }
      if (feePerByteWei == null) {
        feePerByteWei = new BigInteger("800000000");
      }
      if (endpoints == null || endpoints.isEmpty()) {
        endpoints = defaultRelayEndpoints();
      }
    }
  }

  /**
   * External money-market pools reachable without a bridge hop.
   */
  public record MoneyMarket(
      Boolean enabled,
      @PositiveOrZero Integer referralCode,
      /**
       * Chain name to pool contract address.
       */
      Map<String, String> pools
  ) {
    public MoneyMarket {
      if (enabled == null) {
        enabled = false;
      }
      if (referralCode == null) {
        referralCode = 0;
      }
      pools = pools == null ? Map.of() : Map.copyOf(pools);
    }
  }

  private static Map<String, String> defaultCcipSelectors() {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("ethereum", "5009297550715157269");
    m.put("polygon", "4051577828743386545");
    m.put("arbitrum", "4949039107694359620");
    m.put("base", "15971525489660198786");
    m.put("optimism", "3734403246176062136");
    m.put("sepolia", "16015286601757825753");
    m.put("amoy", "16281711391670634445");
    return m;
  }

  private static Map<String, String> defaultAxelarChains() {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("ethereum", "Ethereum");
    m.put("polygon", "Polygon");
    m.put("arbitrum", "arbitrum");
    m.put("base", "base");
    m.put("optimism", "optimism");
    m.put("sepolia", "ethereum-sepolia");
    m.put("amoy", "polygon-sepolia");
    return m;
  }

  private static Map<String, Long> defaultRelayEndpoints() {
    Map<String, Long> m = new LinkedHashMap<>();
    m.put("ethereum", 30101L);
    m.put("polygon", 30109L);
    m.put("arbitrum", 30110L);
    m.put("optimism", 30111L);
    m.put("base", 30184L);
    m.put("sepolia", 40161L);
    m.put("amoy", 40267L);
    return m;
  }
}
