package com.servicevault.identifier.app.model;

/** Visibility classification of an asset. */
public enum AssetType {
  /** Building infrastructure (HVAC, water heater, roof...). Eligible for public disclosure. */
  INFRASTRUCTURE,

  /** Personal belongings. Owner-only, never disclosed. */
  PERSONAL;

  public boolean isDisclosable() {
    return this == INFRASTRUCTURE;
  }

  /** Assets recorded without a classification are infrastructure. */
  public static AssetType orDefault(AssetType type) {
    return type == null ? INFRASTRUCTURE : type;
  }
}
