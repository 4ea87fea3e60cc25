package com.crosslend.bridge.payload;

import java.math.BigInteger;

/**
 * Application payload carried across bridges between vaults.
 *
 * @param requestId 0x-prefixed 32-byte transfer request id (zero for unsolicited syncs)
 * @param account   recipient for RELEASE, payer for REPAY, reporter for SYNC
 */
public record LiquidityInstruction(
    Action action,
    String requestId,
    String account,
    String asset,
    BigInteger amount
) {

  public enum Action {
    /**
     * Remote vault releases reserved liquidity to {@code account} on our chain.
     */
    RELEASE,
    /**
     * Principal returned to the remote vault that funded a borrow.
     */
    REPAY,
    /**
     * Remote vault reports its currently available liquidity.
     */
    SYNC,
    /**
     * Remote vault confirms a RELEASE arrived.
     */
    RELEASE_COMPLETED,
    /**
     * Remote vault could not honour a RELEASE.
     */
    RELEASE_FAILED
  }
}
