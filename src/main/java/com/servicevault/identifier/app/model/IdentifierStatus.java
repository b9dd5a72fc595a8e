package com.servicevault.identifier.app.model;

/** Owner-facing lifecycle state of a property's master identifier. */
public enum IdentifierStatus {
  /** No token was ever issued. */
  UNISSUED,
  ACTIVE,
  /** The current token was revoked; only regenerate leaves this state. */
  REVOKED
}
