package com.servicevault.identifier.app.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One entry of an asset's service history (install, service, inspection, ...). */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssetEvent {

  private String id;
  private String assetId;

  /** INSTALLED, SERVICED, INSPECTION_PASSED, WARRANTY_RENEWED, ... */
  private String type;

  /** Free-form details recorded with the event. */
  private Map<String, Object> data;

  /** Contractor or worker who recorded the event. */
  private String createdBy;

  /** Cost of the work, if recorded. */
  private BigDecimal amount;

  private Instant createdAt;
}
