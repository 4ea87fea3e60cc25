package com.crosslend.core.domain;

public enum RateMode {
  /**
   * Rate follows pool utilization on every accrual.
   */
  VARIABLE,
  /**
   * Rate is snapshotted at borrow/switch time and held for the configured lock period.
   */
  STABLE
}
