package com.crosslend.core.error;

import lombok.NonNull;

/**
 * Single unchecked failure type for the lending engine. The {@link ErrorCode} tells callers
 * whether a retry makes sense; see {@link ErrorCategory}.
 */
public class LendingException extends RuntimeException {

  private final ErrorCode code;

  public LendingException(@NonNull ErrorCode code, String message) {
    super(code.errorName() + ": " + message);
    this.code = code;
  }

  public LendingException(@NonNull ErrorCode code, String message, Throwable cause) {
    super(code.errorName() + ": " + message, cause);
    this.code = code;
  }

  public ErrorCode code() {
    return code;
  }

  public ErrorCategory category() {
    return code.category();
  }

  public boolean is(ErrorCode candidate) {
    return code == candidate;
  }

  public static LendingException of(ErrorCode code, String format, Object... args) {
    return new LendingException(code, args.length == 0 ? format : String.format(format, args));
  }
}
