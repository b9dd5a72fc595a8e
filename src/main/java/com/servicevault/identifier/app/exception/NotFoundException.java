package com.servicevault.identifier.app.exception;

/**
 * Raised for unknown resources. The public read path only ever uses {@link #notAccessible()} so a
 * token that never existed and a revoked token produce the same response.
 */
public class NotFoundException extends IdentifierException {

  public static final String NOT_ACCESSIBLE = "This property history is not accessible";

  public NotFoundException(String message) {
    super(ErrorCode.NOT_FOUND, message);
  }

  public static NotFoundException notAccessible() {
    return new NotFoundException(NOT_ACCESSIBLE);
  }

  public static NotFoundException property(String propertyId) {
    return new NotFoundException("Property not found: " + propertyId);
  }
}
