package com.servicevault.identifier.app.api;

import com.servicevault.identifier.app.exception.ConflictException;
import com.servicevault.identifier.app.exception.ErrorCode;
import com.servicevault.identifier.app.exception.IdentifierException;
import com.servicevault.identifier.app.model.ApiError;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps the error taxonomy onto HTTP statuses and a uniform {@link ApiError} body. */
@Log4j2
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(IdentifierException.class)
  public ResponseEntity<ApiError> handleIdentifier(IdentifierException e) {
    HttpStatus status = statusOf(e.getCode());
    ApiError.ApiErrorBuilder body =
        ApiError.builder().error(e.getCode().name()).message(e.getMessage());
    if (e instanceof ConflictException && ((ConflictException) e).isRegenerateRequired()) {
      body.regenerateRequired(true);
    }
    log.info("api.error code={} message={}", e.getCode(), e.getMessage());
    return ResponseEntity.status(status).body(body.build());
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiError> handleUnreadable(Exception e) {
    return validation("Malformed request body or parameter");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleInvalid(MethodArgumentNotValidException e) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(f -> f.getField() + " " + f.getDefaultMessage())
            .orElse("Invalid request");
    return validation(message);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception e) {
    if (e instanceof ErrorResponse) {
      // framework errors (unknown route, wrong method) keep their own status
      HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
      ApiError body =
          ApiError.builder().error(String.valueOf(status.value())).message(e.getMessage()).build();
      return ResponseEntity.status(status).body(body);
    }
    log.error("api.error.unexpected", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiError.builder().error("INTERNAL_ERROR").message("Unexpected error").build());
  }

  private static ResponseEntity<ApiError> validation(String message) {
    return ResponseEntity.badRequest()
        .body(ApiError.builder().error(ErrorCode.VALIDATION_ERROR.name()).message(message).build());
  }

  static HttpStatus statusOf(ErrorCode code) {
    switch (code) {
      case FORBIDDEN:
        return HttpStatus.FORBIDDEN;
      case NOT_FOUND:
        return HttpStatus.NOT_FOUND;
      case CONFLICT:
        return HttpStatus.CONFLICT;
      case VALIDATION_ERROR:
        return HttpStatus.BAD_REQUEST;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }
}
