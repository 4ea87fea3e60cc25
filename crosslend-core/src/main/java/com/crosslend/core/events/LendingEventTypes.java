package com.crosslend.core.events;

public final class LendingEventTypes {

  public static final String DEPOSIT = "lending.ledger.deposit";
  public static final String WITHDRAW = "lending.ledger.withdraw";
  public static final String BORROW = "lending.ledger.borrow";
  public static final String REPAY = "lending.ledger.repay";
  public static final String LIQUIDATION = "lending.ledger.liquidation";
  public static final String RATE_MODE_SWITCH = "lending.ledger.rate-mode";
  public static final String FLASH_LOAN = "lending.flash-loan";

  public static final String TRANSFER_INITIATED = "lending.transfer.initiated";
  public static final String TRANSFER_COMPLETED = "lending.transfer.completed";
  public static final String TRANSFER_FAILED = "lending.transfer.failed";

  public static final String ADAPTER_REGISTERED = "bridge.adapter.registered";
  public static final String PREFERRED_PROTOCOL_CHANGED = "bridge.preferred-protocol.changed";
  public static final String MESSAGE_SENT = "bridge.message.sent";
  public static final String MESSAGE_RECEIVED = "bridge.message.received";

  public static final String SYSTEM_STATE_CHANGED = "lending.system.state";

  private LendingEventTypes() {
  }
}
