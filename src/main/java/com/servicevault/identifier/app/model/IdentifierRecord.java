package com.servicevault.identifier.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted per-property identifier state: the current token (if any) and the privacy settings.
 *
 * <p>When no token has been issued yet the settings are the pre-seed for the next generate. A
 * record may exist without a token for exactly that reason.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class IdentifierRecord {

  private String propertyId;

  /** Current token, {@code null} until the first generate. */
  private String token;

  private Instant issuedAt;
  private Instant revokedAt;
  private PrivacySettings privacySettings;
  private Instant updatedAt;

  public static IdentifierRecord unissued(String propertyId) {
    return IdentifierRecord.builder()
        .propertyId(propertyId)
        .privacySettings(PrivacySettings.defaults())
        .build();
  }

  @JsonIgnore
  public IdentifierStatus getStatus() {
    if (token == null) return IdentifierStatus.UNISSUED;
    return revokedAt == null ? IdentifierStatus.ACTIVE : IdentifierStatus.REVOKED;
  }

  @JsonIgnore
  public boolean isActive() {
    return getStatus() == IdentifierStatus.ACTIVE;
  }

  @JsonIgnore
  public boolean isRevoked() {
    return getStatus() == IdentifierStatus.REVOKED;
  }

  /** Effective settings, falling back to the defaults for records written without any. */
  @JsonIgnore
  public PrivacySettings effectiveSettings() {
    return PrivacySettings.orDefaults(privacySettings);
  }

  /** The current identifier instance, or {@code null} when none was issued. */
  public MasterIdentifier toMasterIdentifier() {
    if (token == null) return null;
    return MasterIdentifier.builder()
        .propertyId(propertyId)
        .token(token)
        .issuedAt(issuedAt)
        .revokedAt(revokedAt)
        .privacySettings(effectiveSettings())
        .build();
  }
}
