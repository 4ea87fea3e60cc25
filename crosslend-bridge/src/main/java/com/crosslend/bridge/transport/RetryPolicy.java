package com.crosslend.bridge.transport;

public record RetryPolicy(
    boolean enabled,
    int maxAttempts,
    long initialBackoffMillis,
    long maxBackoffMillis
) {

  public static RetryPolicy none() {
    return new RetryPolicy(false, 1, 0, 0);
  }

  public int attempts() {
    return enabled ? Math.max(1, maxAttempts) : 1;
  }

  /**
   * Exponential backoff before attempt {@code attempt + 1} (attempt is 1-based).
   */
  public long backoffMillis(int attempt) {
    if (initialBackoffMillis <= 0) {
      return 0L;
    }
    long shift = Math.min(20, Math.max(0, attempt - 1));
    long backoff = initialBackoffMillis << shift;
    return maxBackoffMillis > 0 ? Math.min(backoff, maxBackoffMillis) : backoff;
  }
}
