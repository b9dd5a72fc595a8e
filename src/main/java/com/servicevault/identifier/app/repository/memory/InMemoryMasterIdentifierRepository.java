package com.servicevault.identifier.app.repository.memory;

import com.servicevault.identifier.app.exception.ConflictException;
import com.servicevault.identifier.app.model.IdentifierRecord;
import com.servicevault.identifier.app.model.MasterIdentifier;
import com.servicevault.identifier.app.model.PrivacySettings;
import com.servicevault.identifier.app.model.TokenRecord;
import com.servicevault.identifier.app.repository.MasterIdentifierRepository;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;

/**
 * Map-backed repository used when no AWS profile is active. Each mutation runs inside {@code
 * compute} on the property's entry, so operations on one property are serialized while the token
 * index is updated within the same critical section.
 */
@Log4j2
public class InMemoryMasterIdentifierRepository implements MasterIdentifierRepository {

  // propertyId -> record
  private final ConcurrentHashMap<String, IdentifierRecord> records = new ConcurrentHashMap<>();

  // token -> index entry
  private final ConcurrentHashMap<String, TokenRecord> tokens = new ConcurrentHashMap<>();

  @Override
  public Optional<IdentifierRecord> findByPropertyId(String propertyId) {
    if (propertyId == null) return Optional.empty();
    IdentifierRecord record = records.get(propertyId);
    return record == null ? Optional.empty() : Optional.of(copy(record));
  }

  @Override
  public Optional<TokenRecord> findByToken(String token) {
    if (token == null) return Optional.empty();
    return Optional.ofNullable(tokens.get(token)).map(t -> t.toBuilder().build());
  }

  @Override
  public IdentifierRecord issue(
      String propertyId, String expectedCurrentToken, MasterIdentifier next) {
    Objects.requireNonNull(next, "next");
    Objects.requireNonNull(next.getToken(), "next.token");

    IdentifierRecord saved =
        records.compute(
            propertyId,
            (id, current) -> {
              String currentToken = current == null ? null : current.getToken();
              if (!Objects.equals(currentToken, expectedCurrentToken)) {
                throw ConflictException.race(id);
              }

              TokenRecord fresh =
                  TokenRecord.builder()
                      .token(next.getToken())
                      .propertyId(id)
                      .issuedAt(next.getIssuedAt())
                      .build();
              if (tokens.putIfAbsent(next.getToken(), fresh) != null) {
                throw ConflictException.race(id);
              }

              if (currentToken != null) {
                tokens.computeIfPresent(
                    currentToken,
                    (t, old) -> old.isRevoked() ? old : revokedCopy(old, next.getIssuedAt()));
              }

              return IdentifierRecord.builder()
                  .propertyId(id)
                  .token(next.getToken())
                  .issuedAt(next.getIssuedAt())
                  .privacySettings(PrivacySettings.orDefaults(next.getPrivacySettings()))
                  .updatedAt(next.getIssuedAt())
                  .build();
            });

    log.debug("memory.issue propertyId={} replaced={}", propertyId, expectedCurrentToken != null);
    return copy(saved);
  }

  @Override
  public IdentifierRecord revoke(String propertyId, String token, Instant revokedAt) {
    IdentifierRecord result =
        records.computeIfPresent(
            propertyId,
            (id, current) -> {
              if (!Objects.equals(current.getToken(), token) || current.isRevoked()) {
                return current;
              }
              tokens.computeIfPresent(
                  token,
                  (t, old) -> old.isRevoked() ? old : revokedCopy(old, revokedAt));
              return current.toBuilder().revokedAt(revokedAt).updatedAt(revokedAt).build();
            });
    return result == null ? IdentifierRecord.unissued(propertyId) : copy(result);
  }

  @Override
  public IdentifierRecord saveSettings(
      String propertyId, PrivacySettings settings, Instant updatedAt) {
    IdentifierRecord saved =
        records.compute(
            propertyId,
            (id, current) -> {
              if (current != null && current.isRevoked()) {
                throw ConflictException.revoked();
              }
              IdentifierRecord base =
                  current == null ? IdentifierRecord.builder().propertyId(id).build() : current;
              return base.toBuilder()
                  .privacySettings(PrivacySettings.orDefaults(settings))
                  .updatedAt(updatedAt)
                  .build();
            });
    return copy(saved);
  }

  /** Every token ever issued for a property, revoked ones included. */
  public List<TokenRecord> tokensOf(String propertyId) {
    return tokens.values().stream()
        .filter(t -> Objects.equals(t.getPropertyId(), propertyId))
        .map(t -> t.toBuilder().build())
        .collect(Collectors.toList());
  }

  private static TokenRecord revokedCopy(TokenRecord token, Instant at) {
    return token.toBuilder().revokedAt(at).build();
  }

  private static IdentifierRecord copy(IdentifierRecord r) {
    PrivacySettings s = r.getPrivacySettings();
    return r.toBuilder().privacySettings(s == null ? null : s.toBuilder().build()).build();
  }
}
