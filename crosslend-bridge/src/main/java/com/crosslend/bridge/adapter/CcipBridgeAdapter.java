package com.crosslend.bridge.adapter;

import com.crosslend.bridge.config.BridgeProperties;
import com.crosslend.bridge.transport.BridgeCall;
import com.crosslend.bridge.transport.BridgeTransport;
import com.crosslend.bridge.transport.RetryPolicy;
import com.crosslend.core.domain.Assets;
import lombok.NonNull;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Chainlink CCIP. Chains are addressed by unsigned 64-bit selectors; fees are paid either natively
 * (attached as value) or in an ERC-20 fee token the router pulls from the vault.
 */
public class CcipBridgeAdapter extends AbstractBridgeAdapter<BigInteger> {

  public static final String PROTOCOL = "ccip";

  private final String routerAddress;
  private final long gasLimit;

  public CcipBridgeAdapter(@NonNull BridgeProperties.Ccip config, @NonNull BridgeTransport transport, RetryPolicy retry) {
    this(ProtocolName.versioned(PROTOCOL, config.protocolVersion()), config, transport, retry);
  }

  public CcipBridgeAdapter(String protocolName, @NonNull BridgeProperties.Ccip config,
                           @NonNull BridgeTransport transport, RetryPolicy retry) {
    super(protocolName, selectorTable(config.selectors()), transport, retry,
        new FeeSchedule(config.baseFeeWei(), config.feePerByteWei()));
    this.routerAddress = Assets.normalize(config.routerAddress());
    this.gasLimit = config.gasLimit();
  }

  @Override
  protected String dispatch(OutboundMessage<BigInteger> message) {
    String calldata = CcipMessageEncoder.encodeCcipSend(
        message.selector(), message.destination(), message.payload(), message.feeAsset(), gasLimit);
    BigInteger value = Assets.isNative(message.feeAsset()) ? message.fee() : BigInteger.ZERO;
    return submitWithRetry(new BridgeCall(getProtocolName(), routerAddress, calldata, value));
  }

  @Override
  protected Optional<BridgeCall> feeQuoteCall(BigInteger selector, byte[] payload) {
    // receiver does not change the fee; quote against the router itself
    String calldata = CcipMessageEncoder.encodeGetFee(selector, routerAddress, payload, Assets.NATIVE, gasLimit);
    return Optional.of(new BridgeCall(getProtocolName(), routerAddress, calldata, BigInteger.ZERO));
  }

  private static ChainSelectorTable<BigInteger> selectorTable(Map<String, String> selectors) {
    Map<String, BigInteger> parsed = new LinkedHashMap<>();
    selectors.forEach((chain, selector) -> parsed.put(chain, new BigInteger(selector.trim())));
    return ChainSelectorTable.of(parsed);
  }
}
