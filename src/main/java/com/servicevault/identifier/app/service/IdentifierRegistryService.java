package com.servicevault.identifier.app.service;

import com.servicevault.identifier.app.config.ServiceConfig.IdentifierProperties;
import com.servicevault.identifier.app.exception.ConflictException;
import com.servicevault.identifier.app.exception.ForbiddenException;
import com.servicevault.identifier.app.exception.NotFoundException;
import com.servicevault.identifier.app.model.IdentifierRecord;
import com.servicevault.identifier.app.model.IdentifierStatusView;
import com.servicevault.identifier.app.model.MasterIdentifier;
import com.servicevault.identifier.app.model.PrivacySettings;
import com.servicevault.identifier.app.model.PrivacySettingsPatch;
import com.servicevault.identifier.app.model.Property;
import com.servicevault.identifier.app.model.ResolvedIdentifier;
import com.servicevault.identifier.app.model.TokenRecord;
import com.servicevault.identifier.app.repository.MasterIdentifierRepository;
import com.servicevault.identifier.app.repository.PropertyCatalog;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

/**
 * Lifecycle of a property's master identifier: generate, regenerate, revoke and public token
 * resolution.
 */
@Log4j2
@Service
@RequiredArgsConstructor
public class IdentifierRegistryService {

  static final String PUBLIC_PATH = "/property/public/";

  private final MasterIdentifierRepository repository;
  private final PropertyCatalog catalog;
  private final OwnershipGuard ownershipGuard;
  private final IdentifierTokenGenerator tokenGenerator;
  private final IdentifierProperties properties;
  private final Clock clock;

  /**
   * Issues a new token for the property, revoking the active one in the same atomic update. The
   * stored (or pre-seeded) settings carry over with {@code overrides} merged on top.
   *
   * @throws ForbiddenException caller does not own the property
   * @throws ConflictException another regenerate won the race
   */
  public IdentifierRecord generate(
      String propertyId, String userId, PrivacySettingsPatch overrides) {
    ownershipGuard.requireOwned(propertyId, userId);

    IdentifierRecord current = current(propertyId);
    PrivacySettings settings = current.effectiveSettings().merge(overrides);

    MasterIdentifier next =
        MasterIdentifier.builder()
            .propertyId(propertyId)
            .token(tokenGenerator.next())
            .issuedAt(clock.instant())
            .privacySettings(settings)
            .build();

    IdentifierRecord issued = repository.issue(propertyId, current.getToken(), next);
    log.info(
        "registry.generate propertyId={} previous={} userId={}",
        propertyId,
        current.getStatus(),
        userId);
    return issued;
  }

  /** Revokes the active token. Revoking a revoked or never-issued identifier is a no-op. */
  public IdentifierRecord revoke(String propertyId, String userId) {
    ownershipGuard.requireOwned(propertyId, userId);

    IdentifierRecord current = current(propertyId);
    if (!current.isActive()) {
      log.info("registry.revoke.noop propertyId={} status={}", propertyId, current.getStatus());
      return current;
    }
    IdentifierRecord revoked = repository.revoke(propertyId, current.getToken(), clock.instant());
    log.info("registry.revoke propertyId={} userId={}", propertyId, userId);
    return revoked;
  }

  /**
   * Resolves a public token. Unknown, revoked, replaced and orphaned tokens all fail with the
   * same {@link NotFoundException#notAccessible()}.
   */
  public ResolvedIdentifier resolveToken(String token) {
    if (token == null || token.isBlank()) throw NotFoundException.notAccessible();

    TokenRecord indexed =
        repository
            .findByToken(token)
            .filter(t -> !t.isRevoked())
            .orElseThrow(NotFoundException::notAccessible);
    IdentifierRecord record =
        repository
            .findByPropertyId(indexed.getPropertyId())
            .orElseThrow(NotFoundException::notAccessible);
    Property property =
        catalog.findProperty(indexed.getPropertyId()).orElseThrow(NotFoundException::notAccessible);

    if (!VisibilityResolver.tokenGrantsAccess(token, property, record)) {
      throw NotFoundException.notAccessible();
    }
    return ResolvedIdentifier.builder().property(property).identifier(record).build();
  }

  /** Owner-facing state, distinguishing UNISSUED, ACTIVE and REVOKED. */
  public IdentifierStatusView status(String propertyId, String userId) {
    ownershipGuard.requireOwned(propertyId, userId);
    return describe(current(propertyId));
  }

  public IdentifierStatusView describe(IdentifierRecord record) {
    return IdentifierStatusView.builder()
        .masterIdentifier(record.getToken())
        .publicVisibility(record.effectiveSettings())
        .revokedAt(record.getRevokedAt())
        .status(record.getStatus())
        .publicUrl(record.isActive() ? publicUrl(record.getToken()) : null)
        .build();
  }

  /** QR payload URL for a token. */
  public String publicUrl(String token) {
    String origin = properties.getPublicOrigin();
    if (origin == null) origin = "";
    while (origin.endsWith("/")) origin = origin.substring(0, origin.length() - 1);
    return origin + PUBLIC_PATH + token;
  }

  private IdentifierRecord current(String propertyId) {
    return repository
        .findByPropertyId(propertyId)
        .orElseGet(() -> IdentifierRecord.unissued(propertyId));
  }
}
