package com.servicevault.identifier.app.exception;

import lombok.Getter;

/** Base of every expected failure raised by the identifier subsystem. */
@Getter
public class IdentifierException extends RuntimeException {

  private final ErrorCode code;

  public IdentifierException(ErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public IdentifierException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  /** Forbidden and validation failures are final for the caller. */
  public boolean isRetryable() {
    return code == ErrorCode.CONFLICT;
  }
}
