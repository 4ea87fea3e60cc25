package com.crosslend.core.error;

public enum ErrorCategory {
  /**
   * Malformed or unsupported input. Rejected synchronously, never retried.
   */
  VALIDATION,
  /**
   * The request conflicts with current state (caller bug or stale view).
   */
  STATE,
  /**
   * Not enough pool, remote or collateral headroom. Caller may retry with a smaller amount.
   */
  LIQUIDITY,
  /**
   * A collaborator (bridge transport, oracle, money market) failed.
   */
  EXTERNAL,
  /**
   * An asynchronous cross-chain transfer failed after dispatch.
   */
  ASYNC
}
