package com.crosslend.core.domain;

public enum TransferStatus {
  PENDING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
