package com.servicevault.identifier.app.exception;

import lombok.Getter;

@Getter
public class ConflictException extends IdentifierException {

  public static final String REGENERATE_TO_MODIFY =
      "Master QR code has been revoked. Please regenerate to make changes.";

  /** True when the owner must regenerate the identifier before editing again. */
  private final boolean regenerateRequired;

  public ConflictException(String message, boolean regenerateRequired) {
    super(ErrorCode.CONFLICT, message);
    this.regenerateRequired = regenerateRequired;
  }

  public static ConflictException revoked() {
    return new ConflictException(REGENERATE_TO_MODIFY, true);
  }

  public static ConflictException race(String propertyId) {
    return new ConflictException(
        "Master identifier of property " + propertyId + " changed concurrently, reload and retry",
        false);
  }
}
