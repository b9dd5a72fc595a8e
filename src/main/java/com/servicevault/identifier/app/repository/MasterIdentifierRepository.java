package com.servicevault.identifier.app.repository;

import com.servicevault.identifier.app.exception.ConflictException;
import com.servicevault.identifier.app.model.IdentifierRecord;
import com.servicevault.identifier.app.model.MasterIdentifier;
import com.servicevault.identifier.app.model.PrivacySettings;
import com.servicevault.identifier.app.model.TokenRecord;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence of identifier records (one per property) and of the token index (one entry per
 * token ever issued). Every method is atomic on its own.
 */
public interface MasterIdentifierRepository {

  Optional<IdentifierRecord> findByPropertyId(String propertyId);

  Optional<TokenRecord> findByToken(String token);

  /**
   * Issues {@code next} as the property's current token and, in the same atomic update, revokes
   * {@code expectedCurrentToken} if it is still active.
   *
   * @param expectedCurrentToken the token the caller read as current, {@code null} if none
   * @throws ConflictException the current token is no longer {@code expectedCurrentToken}, or the
   *     new token value already exists
   */
  IdentifierRecord issue(String propertyId, String expectedCurrentToken, MasterIdentifier next);

  /**
   * Revokes {@code token} if it is still the property's current active token.
   *
   * @return the resulting record; unchanged when the token was already revoked or replaced
   */
  IdentifierRecord revoke(String propertyId, String token, Instant revokedAt);

  /**
   * Replaces the property's privacy settings (last write wins), creating a token-less record if
   * none exists.
   *
   * @throws ConflictException the current token is revoked
   */
  IdentifierRecord saveSettings(String propertyId, PrivacySettings settings, Instant updatedAt);
}
