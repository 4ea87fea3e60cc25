package com.crosslend.bridge.adapter;

import java.math.BigInteger;
import java.util.List;

/**
 * Normalized view of one cross-chain messaging network. Each implementation owns the translation
 * between our chain names and the network's own chain identifiers, and is the only code aware of
 * that network's wire format and fee-token rules.
 */
public interface BridgeAdapter {

  /**
   * Dispatches {@code payload} to {@code destinationAddress} on {@code chainName}.
   * Sending the same message twice returns the same id without a second dispatch.
   *
   * @param feeAsset asset the bridge fee is paid in; the zero address means the native asset
   * @return protocol message id (0x-prefixed 32-byte hex)
   */
  String sendMessage(String chainName, String destinationAddress, byte[] payload, String feeAsset);

  /**
   * Fee quote for a message of this shape, in base units of the adapter's default fee asset.
   * No side effects.
   */
  BigInteger estimateGas(String chainName, byte[] payload);

  boolean isChainSupported(String chainName);

  List<String> getSupportedChains();

  String getProtocolName();
}
