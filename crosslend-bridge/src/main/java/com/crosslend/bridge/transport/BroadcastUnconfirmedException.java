package com.crosslend.bridge.transport;

/**
 * The transaction reached the network but no receipt came back in time. Never retried: a second
 * broadcast would deliver the message twice.
 */
public class BroadcastUnconfirmedException extends RuntimeException {

  private final String txHash;

  public BroadcastUnconfirmedException(String txHash, String message, Throwable cause) {
    super(message, cause);
    this.txHash = txHash;
  }

  public String txHash() {
    return txHash;
  }
}
