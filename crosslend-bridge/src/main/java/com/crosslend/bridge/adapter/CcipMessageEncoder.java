package com.crosslend.bridge.adapter;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * ABI encoder for the CCIP router:
 * <pre>
 * struct EVM2AnyMessage { bytes receiver; bytes data; EVMTokenAmount[] tokenAmounts; address feeToken; bytes extraArgs; }
 * function ccipSend(uint64 destinationChainSelector, EVM2AnyMessage message) payable returns (bytes32)
 * function getFee(uint64 destinationChainSelector, EVM2AnyMessage message) view returns (uint256)
 * </pre>
 * Web3j's static encoder has no tuple support, so the struct is laid out by hand. We never bridge
 * tokens, so {@code tokenAmounts} is always empty.
 */
final class CcipMessageEncoder {

  private static final String MESSAGE_TUPLE = "(bytes,bytes,(address,uint256)[],address,bytes)";
  private static final byte[] SELECTOR_CCIP_SEND = selector("ccipSend(uint64," + MESSAGE_TUPLE + ")");
  private static final byte[] SELECTOR_GET_FEE = selector("getFee(uint64," + MESSAGE_TUPLE + ")");

  // bytes4(keccak256("CCIP EVMExtraArgsV1"))
  private static final byte[] EVM_EXTRA_ARGS_V1_TAG = Numeric.hexStringToByteArray("0x97a657c9");

  private CcipMessageEncoder() {
  }

  static String encodeCcipSend(BigInteger chainSelector, String receiver, byte[] data, String feeToken, long gasLimit) {
    return encodeCall(SELECTOR_CCIP_SEND, chainSelector, receiver, data, feeToken, gasLimit);
  }

  static String encodeGetFee(BigInteger chainSelector, String receiver, byte[] data, String feeToken, long gasLimit) {
    return encodeCall(SELECTOR_GET_FEE, chainSelector, receiver, data, feeToken, gasLimit);
  }

  static byte[] selector(String signature) {
    return Numeric.hexStringToByteArray(Hash.sha3String(signature).substring(0, 10));
  }

  static byte[] extraArgs(long gasLimit) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(EVM_EXTRA_ARGS_V1_TAG);
    out.writeBytes(encodeUint256(BigInteger.valueOf(gasLimit)));
    return out.toByteArray();
  }

  private static String encodeCall(byte[] selector, BigInteger chainSelector, String receiver, byte[] data,
                                   String feeToken, long gasLimit) {
    if (chainSelector.signum() < 0 || chainSelector.bitLength() > 64) {
      throw new IllegalArgumentException("chain selector is not a uint64: " + chainSelector);
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(selector);
    // head: uint64 selector, offset to the dynamic message tuple
    out.writeBytes(encodeUint256(chainSelector));
    out.writeBytes(encodeUint256(BigInteger.valueOf(64)));
    out.writeBytes(encodeMessage(encodeAddress(receiver), data == null ? new byte[0] : data, feeToken, extraArgs(gasLimit)));
    return Numeric.toHexString(out.toByteArray());
  }

  private static byte[] encodeMessage(byte[] receiver, byte[] data, String feeToken, byte[] extraArgs) {
    byte[] receiverTail = encodeBytes(receiver);
    byte[] dataTail = encodeBytes(data);
    byte[] tokenAmountsTail = encodeUint256(BigInteger.ZERO);
    byte[] extraArgsTail = encodeBytes(extraArgs);

    int head = 32 * 5;
    int receiverOffset = head;
    int dataOffset = receiverOffset + receiverTail.length;
    int tokenAmountsOffset = dataOffset + dataTail.length;
    int extraArgsOffset = tokenAmountsOffset + tokenAmountsTail.length;

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(encodeUint256(BigInteger.valueOf(receiverOffset)));
    out.writeBytes(encodeUint256(BigInteger.valueOf(dataOffset)));
    out.writeBytes(encodeUint256(BigInteger.valueOf(tokenAmountsOffset)));
    out.writeBytes(encodeAddress(feeToken));
    out.writeBytes(encodeUint256(BigInteger.valueOf(extraArgsOffset)));
    out.writeBytes(receiverTail);
    out.writeBytes(dataTail);
    out.writeBytes(tokenAmountsTail);
    out.writeBytes(extraArgsTail);
    return out.toByteArray();
  }

  private static byte[] encodeUint256(BigInteger v) {
    return Numeric.toBytesPadded(v, 32);
  }

  private static byte[] encodeAddress(String addressHex) {
    String addr = Numeric.cleanHexPrefix(addressHex == null ? "" : addressHex.trim());
    if (addr.length() != 40) {
      throw new IllegalArgumentException("Expected 20-byte address hex, got: " + addressHex);
    }
    byte[] padded = new byte[32];
    System.arraycopy(Numeric.hexStringToByteArray(addr), 0, padded, 12, 20);
    return padded;
  }

  private static byte[] encodeBytes(byte[] data) {
    int len = data.length;
    int paddedLen = ((len + 31) / 32) * 32;
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(encodeUint256(BigInteger.valueOf(len)));
    out.writeBytes(data);
    if (paddedLen > len) {
      out.writeBytes(new byte[paddedLen - len]);
    }
    return out.toByteArray();
  }
}
