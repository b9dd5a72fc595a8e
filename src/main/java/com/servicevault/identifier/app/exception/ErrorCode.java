package com.servicevault.identifier.app.exception;

/** Error taxonomy shared by the service and its HTTP client. */
public enum ErrorCode {
  /** A non-owner attempted an owner-only operation. */
  FORBIDDEN,

  /** Unknown or revoked token, unknown property or asset. */
  NOT_FOUND,

  /** Privacy edit while revoked, or a regenerate race. */
  CONFLICT,

  /** Malformed request payload. */
  VALIDATION_ERROR
}
