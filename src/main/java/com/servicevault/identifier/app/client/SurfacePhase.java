package com.servicevault.identifier.app.client;

/** Lifecycle of the owner's identifier surface. */
public enum SurfacePhase {
  LOADING,
  UNISSUED,
  ACTIVE,
  REVOKED,

  /** Generate or revoke awaiting its response. */
  MUTATING,

  /** The initial load failed. */
  ERROR
}
