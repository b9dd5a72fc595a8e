package com.servicevault.identifier.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One issued public token of a property. Each regenerate creates a new instance with its own
 * lifecycle; revocation of an instance is permanent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MasterIdentifier {

  private String propertyId;

  /** Opaque, globally unique, embedded in the QR payload. */
  private String token;

  private Instant issuedAt;

  private Instant revokedAt;

  private PrivacySettings privacySettings;

  @JsonIgnore
  public boolean isActive() {
    return token != null && revokedAt == null;
  }
}
