package com.crosslend.bridge.adapter;

import com.crosslend.bridge.config.BridgeProperties;
import com.crosslend.bridge.transport.BridgeCall;
import com.crosslend.bridge.transport.BridgeTransport;
import com.crosslend.bridge.transport.RetryPolicy;
import com.crosslend.core.domain.Assets;
import lombok.NonNull;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Endpoint-style relay. Chains are addressed by 32-bit endpoint ids and the receiver by its
 * left-padded bytes32 form. Fees are native only.
 */
public class MessageRelayAdapter extends AbstractBridgeAdapter<Long> {

  public static final String PROTOCOL = "relay";

  private final String endpointAddress;

  public MessageRelayAdapter(@NonNull BridgeProperties.Relay config, @NonNull BridgeTransport transport, RetryPolicy retry) {
    this(PROTOCOL, config, transport, retry);
  }

  public MessageRelayAdapter(String protocolName, @NonNull BridgeProperties.Relay config,
                             @NonNull BridgeTransport transport, RetryPolicy retry) {
    super(protocolName, ChainSelectorTable.of(config.endpoints()), transport, retry,
        new FeeSchedule(config.baseFeeWei(), config.feePerByteWei()));
    this.endpointAddress = Assets.normalize(config.endpointAddress());
  }

  @Override
  protected String dispatch(OutboundMessage<Long> message) {
    if (!Assets.isNative(message.feeAsset())) {
      throw unsupportedFeeAsset(message.feeAsset());
    }
    Function send = new Function(
        "sendMessage",
        List.of(
            new Uint32(message.selector()),
            new Bytes32(Numeric.toBytesPadded(Numeric.toBigInt(message.destination()), 32)),
            new DynamicBytes(message.payload()),
            new Address(message.destination())),
        List.of()
    );
    return submitWithRetry(new BridgeCall(getProtocolName(), endpointAddress, FunctionEncoder.encode(send), message.fee()));
  }

  @Override
  protected Optional<BridgeCall> feeQuoteCall(Long endpointId, byte[] payload) {
    Function quote = new Function("quote", List.of(new Uint32(endpointId), new DynamicBytes(payload)), List.of());
    return Optional.of(new BridgeCall(getProtocolName(), endpointAddress, FunctionEncoder.encode(quote), BigInteger.ZERO));
  }
}
