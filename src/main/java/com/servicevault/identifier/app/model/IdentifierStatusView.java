package com.servicevault.identifier.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Owner-facing identifier state, returned by the read and mutation endpoints alike so the client
 * can always reconcile against the full resulting object.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class IdentifierStatusView {

  /** Current token, or {@code null} when never issued. Still shown to the owner when revoked. */
  private String masterIdentifier;

  private PrivacySettings publicVisibility;

  private Instant revokedAt;

  private IdentifierStatus status;

  /** QR payload URL, present only while active. */
  private String publicUrl;
}
