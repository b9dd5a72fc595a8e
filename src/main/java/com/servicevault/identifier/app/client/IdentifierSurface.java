package com.servicevault.identifier.app.client;

import com.servicevault.identifier.app.exception.ErrorCode;
import com.servicevault.identifier.app.model.IdentifierStatusView;
import com.servicevault.identifier.app.model.PrivacySettings;
import lombok.Builder;
import lombok.Value;

/** Immutable snapshot of what the owner's identifier panel shows. */
@Value
@Builder(toBuilder = true)
public class IdentifierSurface {

  String propertyId;
  SurfacePhase phase;

  /** Last authoritative server state, {@code null} before the first successful load. */
  IdentifierStatusView identifier;

  /** Settings as displayed, optimistic while a privacy update is pending. */
  PrivacySettings settings;

  /** Settings to roll back to if the pending privacy update fails. */
  PrivacySettings lastGoodSettings;

  PendingAction pendingAction;

  String error;
  ErrorCode errorCode;

  /** The last edit was refused because the identifier is revoked. */
  boolean regenerateRequired;

  public static IdentifierSurface loading(String propertyId) {
    return IdentifierSurface.builder().propertyId(propertyId).phase(SurfacePhase.LOADING).build();
  }

  /** Disclosure toggles are usable only on a settled, non-revoked identifier. */
  public boolean controlsEnabled() {
    if (pendingAction != null && pendingAction.isDestructive()) return false;
    return phase == SurfacePhase.ACTIVE || phase == SurfacePhase.UNISSUED;
  }

  public boolean publicLinkShown() {
    return phase == SurfacePhase.ACTIVE && identifier != null && identifier.getPublicUrl() != null;
  }
}
