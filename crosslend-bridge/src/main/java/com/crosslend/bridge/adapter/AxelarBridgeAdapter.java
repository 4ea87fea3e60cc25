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
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.List;

/**
 * Axelar general message passing. Chains are addressed by Axelar's chain-name strings and the
 * destination contract by its hex string. Gas is prepaid to the gas service, then the gateway call
 * is made; both go out as separate transactions.
 */
public class AxelarBridgeAdapter extends AbstractBridgeAdapter<String> {

  public static final String PROTOCOL = "axelar";

  private final String gatewayAddress;
  private final String gasServiceAddress;

  public AxelarBridgeAdapter(@NonNull BridgeProperties.Axelar config, @NonNull BridgeTransport transport, RetryPolicy retry) {
    this(PROTOCOL, config, transport, retry);
  }

  public AxelarBridgeAdapter(String protocolName, @NonNull BridgeProperties.Axelar config,
                             @NonNull BridgeTransport transport, RetryPolicy retry) {
    super(protocolName, ChainSelectorTable.of(config.chains()), transport, retry,
        new FeeSchedule(config.baseFeeWei(), config.feePerByteWei()));
    this.gatewayAddress = Assets.normalize(config.gatewayAddress());
    this.gasServiceAddress = Assets.normalize(config.gasServiceAddress());
  }

  @Override
  protected String dispatch(OutboundMessage<String> message) {
    submitWithRetry(gasPayment(message));
    Function callContract = new Function(
        "callContract",
        List.of(new Utf8String(message.selector()), new Utf8String(message.destination()), new DynamicBytes(message.payload())),
        List.of()
    );
    return submitWithRetry(new BridgeCall(getProtocolName(), gatewayAddress, FunctionEncoder.encode(callContract), BigInteger.ZERO));
  }

  private BridgeCall gasPayment(OutboundMessage<String> message) {
    // unused gas is refunded to the receiving vault
    Address refund = new Address(message.destination());
    if (Assets.isNative(message.feeAsset())) {
      Function payNative = new Function(
          "payNativeGasForContractCall",
          List.of(
              new Address(gatewayAddress),
              new Utf8String(message.selector()),
              new Utf8String(message.destination()),
              new DynamicBytes(message.payload()),
              refund),
          List.of()
      );
      return new BridgeCall(getProtocolName(), gasServiceAddress, FunctionEncoder.encode(payNative), message.fee());
    }
    Function payToken = new Function(
        "payGasForContractCall",
        List.of(
            new Address(gatewayAddress),
            new Utf8String(message.selector()),
            new Utf8String(message.destination()),
            new DynamicBytes(message.payload()),
            new Address(message.feeAsset()),
            new Uint256(message.fee()),
            refund),
        List.of()
    );
    return new BridgeCall(getProtocolName(), gasServiceAddress, FunctionEncoder.encode(payToken), BigInteger.ZERO);
  }
}
