package com.servicevault.identifier.app.exception;

public class ForbiddenException extends IdentifierException {

  public ForbiddenException(String message) {
    super(ErrorCode.FORBIDDEN, message);
  }

  public static ForbiddenException notOwner(String propertyId) {
    return new ForbiddenException("Only the owner of property " + propertyId + " may do this");
  }
}
