package com.crosslend.core.domain;

public enum Role {
  /**
   * Pauses the system, lists assets, registers adapters and grants roles.
   */
  OWNER,
  /**
   * Relayer/adapter account allowed to resolve pending cross-chain transfers.
   */
  COMPLETION_CALLER
}
