package com.servicevault.identifier.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-property disclosure flags for the public projection. Each flag covers one field group and
 * is all-or-nothing for that group.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class PrivacySettings {

  /** Street line and postal code; off means city/state only. */
  private boolean showFullAddress;

  /** Installer and contractor identities on assets, events and documents. */
  private boolean showContractors;

  /** Document list; off means an empty list. */
  private boolean showDocuments;

  /** Amounts and purchase prices. */
  private boolean showCosts;

  public static PrivacySettings defaults() {
    return PrivacySettings.builder()
        .showFullAddress(false)
        .showContractors(true)
        .showDocuments(false)
        .showCosts(false)
        .build();
  }

  public static PrivacySettings orDefaults(PrivacySettings settings) {
    return settings == null ? defaults() : settings.toBuilder().build();
  }

  public boolean get(PrivacyField field) {
    switch (field) {
      case SHOW_FULL_ADDRESS:
        return showFullAddress;
      case SHOW_CONTRACTORS:
        return showContractors;
      case SHOW_DOCUMENTS:
        return showDocuments;
      case SHOW_COSTS:
        return showCosts;
      default:
        throw new IllegalArgumentException("Unknown privacy field " + field);
    }
  }

  /** Copy with one flag changed. */
  public PrivacySettings with(PrivacyField field, boolean value) {
    return merge(PrivacySettingsPatch.of(field, value));
  }

  /** Copy with every field present in {@code patch} applied; absent fields keep their value. */
  public PrivacySettings merge(PrivacySettingsPatch patch) {
    PrivacySettings next = toBuilder().build();
    if (patch == null) return next;
    if (patch.getShowFullAddress() != null) next.setShowFullAddress(patch.getShowFullAddress());
    if (patch.getShowContractors() != null) next.setShowContractors(patch.getShowContractors());
    if (patch.getShowDocuments() != null) next.setShowDocuments(patch.getShowDocuments());
    if (patch.getShowCosts() != null) next.setShowCosts(patch.getShowCosts());
    return next;
  }
}
