package com.crosslend.core.error;

public enum ErrorCode {
  ZERO_AMOUNT("ZeroAmount", ErrorCategory.VALIDATION),
  UNSUPPORTED_ASSET("UnsupportedAsset", ErrorCategory.VALIDATION),
  UNSUPPORTED_CHAIN("UnsupportedChain", ErrorCategory.VALIDATION),
  INVALID_ADDRESS("InvalidAddress", ErrorCategory.VALIDATION),
  INVALID_PROTOCOL_NAME("InvalidProtocolName", ErrorCategory.VALIDATION),
  INSUFFICIENT_BALANCE("InsufficientBalance", ErrorCategory.VALIDATION),

  ALREADY_REGISTERED("AlreadyRegistered", ErrorCategory.STATE),
  UNKNOWN_PROTOCOL("UnknownProtocol", ErrorCategory.STATE),
  INVALID_STATE("InvalidState", ErrorCategory.STATE),
  NOT_PENDING("NotPending", ErrorCategory.STATE),
  UNKNOWN_REQUEST("UnknownRequest", ErrorCategory.STATE),
  PAUSED_STATE("PausedState", ErrorCategory.STATE),
  UNAUTHORIZED("Unauthorized", ErrorCategory.STATE),
  REENTRANT_CALL("ReentrantCall", ErrorCategory.STATE),
  COMPLIANCE_REQUIRED("ComplianceRequired", ErrorCategory.STATE),
  HEALTHY_POSITION("HealthyPosition", ErrorCategory.STATE),
  FLASH_LOANS_DISABLED("FlashLoansDisabled", ErrorCategory.STATE),

  INSUFFICIENT_LIQUIDITY("InsufficientLiquidity", ErrorCategory.LIQUIDITY),
  INSUFFICIENT_REMOTE_LIQUIDITY("InsufficientRemoteLiquidity", ErrorCategory.LIQUIDITY),
  INSUFFICIENT_COLLATERAL("InsufficientCollateral", ErrorCategory.LIQUIDITY),
  UNDERCOLLATERALIZED("Undercollateralized", ErrorCategory.LIQUIDITY),
  NO_LIQUIDITY_ROUTE("NoLiquidityRoute", ErrorCategory.LIQUIDITY),
  FLASH_LOAN_NOT_REPAID("FlashLoanNotRepaid", ErrorCategory.LIQUIDITY),

  BRIDGE_DISPATCH_FAILED("BridgeDispatchFailed", ErrorCategory.EXTERNAL),
  ORACLE_UNAVAILABLE("OracleUnavailable", ErrorCategory.EXTERNAL),
  SOURCE_UNAVAILABLE("SourceUnavailable", ErrorCategory.EXTERNAL),

  TRANSFER_FAILED("TransferFailed", ErrorCategory.ASYNC);

  private final String errorName;
  private final ErrorCategory category;

  ErrorCode(String errorName, ErrorCategory category) {
    this.errorName = errorName;
    this.category = category;
  }

  public String errorName() {
    return errorName;
  }

  public ErrorCategory category() {
    return category;
  }
}
