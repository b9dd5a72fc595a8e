package com.servicevault.identifier.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Error body of every non-2xx API response. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  /** {@code FORBIDDEN}, {@code NOT_FOUND}, {@code CONFLICT}, {@code VALIDATION_ERROR}, ... */
  private String error;

  private String message;

  /** Set on a conflict the owner can only resolve by regenerating. */
  private Boolean regenerateRequired;
}
