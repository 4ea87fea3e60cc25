package com.crosslend.bridge.transport;

import java.math.BigInteger;
import java.util.Optional;

/**
 * The wire under an adapter: signs and broadcasts {@link BridgeCall}s on the source chain.
 */
public interface BridgeTransport {

  /**
   * @return source-chain transaction hash
   * @throws RetryableBridgeException when the same call may succeed if tried again
   */
  String submit(BridgeCall call);

  /**
   * Read-only fee query ({@code eth_call}); empty when the transport cannot answer.
   */
  Optional<BigInteger> quoteFee(BridgeCall quoteCall);
}
