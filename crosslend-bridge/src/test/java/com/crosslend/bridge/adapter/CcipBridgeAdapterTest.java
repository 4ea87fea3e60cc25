package com.crosslend.bridge.adapter;

import com.crosslend.bridge.config.BridgeProperties;
import com.crosslend.bridge.transport.BridgeCall;
import com.crosslend.bridge.transport.RetryPolicy;
import com.crosslend.bridge.transport.SimulatedBridgeTransport;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CcipBridgeAdapterTest {

  private static final String VAULT = "0x00000000000000000000000000000000000c0de2";
  private static final String LINK = "0x514910771af9ca656af840dff83e8264ecf986ca";
  private static final byte[] PAYLOAD = Numeric.hexStringToByteArray("0xdeadbeef");

  private final SimulatedBridgeTransport transport = new SimulatedBridgeTransport();
  private final BridgeProperties.Ccip config = new BridgeProperties.Ccip(null, null, null, null, null, null, null);
  private final CcipBridgeAdapter adapter = new CcipBridgeAdapter(config, transport, new RetryPolicy(true, 3, 0, 0));

  @Test
  void translatesChainNamesToCcipSelectors() {
    assertThat(adapter.getProtocolName()).isEqualTo("ccip");
    assertThat(adapter.selectorFor("polygon")).contains(new BigInteger("4051577828743386545"));
    assertThat(adapter.chainFor(new BigInteger("15971525489660198786"))).contains("base");
    assertThat(adapter.isChainSupported("solana")).isFalse();
  }

  @Test
  void sendsCcipSendWithNativeFeeAttached() {
    adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE);

    BridgeCall call = transport.submittedCalls().get(0);
    String selector = methodId("ccipSend(uint64,(bytes,bytes,(address,uint256)[],address,bytes))");
    assertThat(selector).isEqualTo("0x96f4e9f9");
    assertThat(call.calldata()).startsWith(selector);
    assertThat(call.calldata().substring(10, 74))
        .isEqualTo(Numeric.toHexStringNoPrefixZeroPadded(new BigInteger("4051577828743386545"), 64));
    assertThat(call.target()).isEqualTo(config.routerAddress());
    assertThat(call.value()).isEqualTo(adapter.estimateGas("polygon", PAYLOAD));
  }

  @Test
  void tokenFeeIsPulledNotAttached() {
    adapter.sendMessage("polygon", VAULT, PAYLOAD, LINK);

    BridgeCall call = transport.submittedCalls().get(0);
    assertThat(call.value()).isZero();
    assertThat(call.calldata()).contains(LINK.substring(2));
  }

  @Test
  void sameMessageIsDispatchedOnce() {
    String first = adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE);
    String second = adapter.sendMessage("Polygon", VAULT.toUpperCase().replace("0X", "0x"), PAYLOAD, Assets.NATIVE);
    String other = adapter.sendMessage("arbitrum", VAULT, PAYLOAD, Assets.NATIVE);

    assertThat(second).isEqualTo(first);
    assertThat(other).isNotEqualTo(first);
    assertThat(transport.submittedCalls()).hasSize(2);
    assertThat(adapter.wasDispatched(first)).isTrue();
  }

  @Test
  void retriesTransientFailuresWithinBudget() {
    transport.failNext(2, true);

    String messageId = adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE);

    assertThat(messageId).startsWith("0x").hasSize(66);
    assertThat(transport.submittedCalls()).hasSize(1);
  }

  @Test
  void givesUpWhenRetriesAreExhaustedAndAllowsLaterResend() {
    transport.failNext(3, true);

    assertThatThrownBy(() -> adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE))
        .isInstanceOf(LendingException.class)
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.BRIDGE_DISPATCH_FAILED));

    adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE);
    assertThat(transport.submittedCalls()).hasSize(1);
  }

  @Test
  void doesNotRetryPermanentRejections() {
    transport.failNext(1, false);

    assertThatThrownBy(() -> adapter.sendMessage("polygon", VAULT, PAYLOAD, Assets.NATIVE))
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.BRIDGE_DISPATCH_FAILED));
    assertThat(transport.submittedCalls()).isEmpty();
  }

  @Test
  void estimatePrefersOnChainQuote() {
    BigInteger scheduled = config.baseFeeWei().add(config.feePerByteWei().multiply(BigInteger.valueOf(PAYLOAD.length)));
    assertThat(adapter.estimateGas("polygon", PAYLOAD)).isEqualTo(scheduled);

    transport.setQuotedFee(BigInteger.valueOf(42));
    assertThat(adapter.estimateGas("polygon", PAYLOAD)).isEqualTo(BigInteger.valueOf(42));
    assertThat(transport.submittedCalls()).isEmpty();
  }

  @Test
  void unknownChainIsRejected() {
    assertThatThrownBy(() -> adapter.sendMessage("solana", VAULT, PAYLOAD, Assets.NATIVE))
        .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.UNSUPPORTED_CHAIN));
  }

  @Test
  void versionedNameComesFromConfiguration() {
    BridgeProperties.Ccip v2 = new BridgeProperties.Ccip(null, null, null, null, null, 2, null);
    assertThat(new CcipBridgeAdapter(v2, transport, RetryPolicy.none()).getProtocolName()).isEqualTo("ccip-v2");
  }

  private static String methodId(String signature) {
    return Hash.sha3String(signature).substring(0, 10);
  }
}
