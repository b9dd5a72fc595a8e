package com.servicevault.identifier.app.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata of a stored document (receipt, warranty, manual, inspection report...). The binary
 * lives in the document storage subsystem under {@code path}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertyDocument {

  private String id;
  private String propertyId;

  /** Asset the document belongs to; {@code null} for property-level documents. */
  private String assetId;

  private String type;
  private String title;

  /** Storage key, never returned to callers. */
  private String path;

  private String uploadedBy;
  private BigDecimal amount;
  private LocalDate issueDate;
  private LocalDate expiryDate;
  private Instant uploadedAt;
}
