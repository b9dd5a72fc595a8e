package com.servicevault.identifier.app.model;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** The four disclosure toggles, keyed by their wire name. */
@Getter
@RequiredArgsConstructor
public enum PrivacyField {
  SHOW_FULL_ADDRESS("showFullAddress"),
  SHOW_CONTRACTORS("showContractors"),
  SHOW_DOCUMENTS("showDocuments"),
  SHOW_COSTS("showCosts");

  private final String key;

  public static Optional<PrivacyField> fromKey(String key) {
    return Arrays.stream(values()).filter(f -> f.key.equals(key)).findFirst();
  }
}
