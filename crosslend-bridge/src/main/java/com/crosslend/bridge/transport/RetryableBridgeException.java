package com.crosslend.bridge.transport;

/** Marker exception indicating the dispatch can be retried (RPC hiccup, nonce race, timeout). */
public class RetryableBridgeException extends RuntimeException {
  public RetryableBridgeException(String message) { super(message); }
  public RetryableBridgeException(String message, Throwable cause) { super(message, cause); }
}
