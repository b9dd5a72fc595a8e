package com.servicevault.identifier.app.client;

import com.servicevault.identifier.app.exception.IdentifierException;
import com.servicevault.identifier.app.model.IdentifierStatusView;
import com.servicevault.identifier.app.model.PrivacySettingsPatch;

/**
 * Owner-side transport to the identifier endpoints. Implementations block until the response
 * arrives and raise the matching {@link IdentifierException} subtype for API errors.
 */
public interface IdentifierApi {

  IdentifierStatusView fetch(String propertyId);

  /** Generates, or regenerates, with {@code overrides} merged over the stored settings. */
  IdentifierStatusView generate(String propertyId, PrivacySettingsPatch overrides);

  IdentifierStatusView updatePrivacy(String propertyId, PrivacySettingsPatch patch);

  void revoke(String propertyId);
}
