package com.crosslend.core.domain;

public enum ExecutionMode {
  /**
   * In-process custody and simulated bridge transport. Nothing is broadcast.
   */
  PAPER,
  /**
   * Bridge calls are signed and broadcast through the configured JSON-RPC endpoint.
   */
  LIVE,
}
