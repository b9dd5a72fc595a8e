package com.servicevault.identifier.app.service;

import com.servicevault.identifier.app.exception.ConflictException;
import com.servicevault.identifier.app.model.IdentifierRecord;
import com.servicevault.identifier.app.model.PrivacySettings;
import com.servicevault.identifier.app.model.PrivacySettingsPatch;
import com.servicevault.identifier.app.repository.MasterIdentifierRepository;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

/**
 * Per-property privacy settings. Before the first generate the stored settings act as the
 * pre-seed the next identifier starts with; while the identifier is revoked they are frozen.
 */
@Log4j2
@Service
@RequiredArgsConstructor
public class PrivacySettingsService {

  private final MasterIdentifierRepository repository;
  private final OwnershipGuard ownershipGuard;
  private final Clock clock;

  /**
   * Merges {@code patch} into the stored settings. Last write wins.
   *
   * @return the full resulting settings
   * @throws ConflictException the current identifier is revoked
   */
  public PrivacySettings update(String propertyId, String userId, PrivacySettingsPatch patch) {
    ownershipGuard.requireOwned(propertyId, userId);

    IdentifierRecord current =
        repository
            .findByPropertyId(propertyId)
            .orElseGet(() -> IdentifierRecord.unissued(propertyId));
    if (current.isRevoked()) {
      log.info("privacy.update.rejected propertyId={} reason=revoked", propertyId);
      throw ConflictException.revoked();
    }

    PrivacySettings merged = current.effectiveSettings().merge(patch);
    IdentifierRecord saved = repository.saveSettings(propertyId, merged, clock.instant());
    log.info(
        "privacy.update propertyId={} status={} settings={}",
        propertyId,
        saved.getStatus(),
        merged);
    return saved.effectiveSettings();
  }

  public PrivacySettings current(String propertyId, String userId) {
    ownershipGuard.requireOwned(propertyId, userId);
    return repository
        .findByPropertyId(propertyId)
        .map(IdentifierRecord::effectiveSettings)
        .orElseGet(PrivacySettings::defaults);
  }
}
