package com.servicevault.identifier.app.exception;

public class ValidationException extends IdentifierException {

  public ValidationException(String message) {
    super(ErrorCode.VALIDATION_ERROR, message);
  }
}
