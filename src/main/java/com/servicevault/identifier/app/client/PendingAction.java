package com.servicevault.identifier.app.client;

public enum PendingAction {
  GENERATE,
  REVOKE,
  PRIVACY_UPDATE;

  /** Generate and revoke replace the public token; they are never applied optimistically. */
  public boolean isDestructive() {
    return this != PRIVACY_UPDATE;
  }
}
