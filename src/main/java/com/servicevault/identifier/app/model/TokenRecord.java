package com.servicevault.identifier.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Token index entry. Kept for every token ever issued so revocation stays permanent. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TokenRecord {

  private String token;
  private String propertyId;
  private Instant issuedAt;
  private Instant revokedAt;

  public boolean isRevoked() {
    return revokedAt != null;
  }
}
