package com.crosslend.core.domain;

import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import org.web3j.crypto.WalletUtils;

import java.util.Locale;

/**
 * Validators/normalizers for EVM addresses used as asset and account identifiers.
 */
public final class Assets {

  /**
   * The chain's native asset. Its balances live on the {@code Position}, not in a token slot.
   */
  public static final String NATIVE = "0x0000000000000000000000000000000000000000";

  private Assets() {
  }

  public static String normalize(String address) {
    if (address == null) {
      throw new LendingException(ErrorCode.INVALID_ADDRESS, "address is null");
    }
    String trimmed = address.trim();
    if (!trimmed.startsWith("0x") && !trimmed.startsWith("0X")) {
      throw new LendingException(ErrorCode.INVALID_ADDRESS, "address must start with 0x: " + address);
    }
    if (!WalletUtils.isValidAddress(trimmed)) {
      throw new LendingException(ErrorCode.INVALID_ADDRESS, "invalid address (need 40 hex chars): " + address);
    }
    return "0x" + trimmed.substring(2).toLowerCase(Locale.ROOT);
  }

  public static boolean isNative(String address) {
    return NATIVE.equals(address);
  }
}
