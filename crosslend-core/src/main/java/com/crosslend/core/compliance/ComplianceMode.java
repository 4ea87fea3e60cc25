package com.crosslend.core.compliance;

public enum ComplianceMode {
  /**
   * The gate is not consulted.
   */
  PERMISSIVE,
  /**
   * Deposits and borrows require a verified identity (and the configured claim, if any).
   */
  RESTRICTIVE
}
