package com.crosslend.bridge.transport;

import java.math.BigInteger;

/**
 * One contract call on the source chain that hands a message to a bridge network.
 *
 * @param target   router / gateway / endpoint / pool contract
 * @param calldata 0x-prefixed ABI calldata
 * @param value    native value attached (bridge fee when paid natively)
 */
public record BridgeCall(
    String protocol,
    String target,
    String calldata,
    BigInteger value
) {
  public BridgeCall {
    if (value == null) {
      value = BigInteger.ZERO;
    }
  }
}
