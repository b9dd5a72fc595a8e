package com.servicevault.identifier.app.client;

import com.servicevault.identifier.app.exception.ConflictException;
import com.servicevault.identifier.app.model.IdentifierStatus;
import com.servicevault.identifier.app.model.IdentifierStatusView;
import com.servicevault.identifier.app.model.PrivacySettings;
import com.servicevault.identifier.app.model.PrivacySettingsPatch;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/** Server stand-in with the same state rules as the identifier endpoints. */
class FakeIdentifierApi implements IdentifierApi {

  final Map<String, IdentifierStatusView> state = new HashMap<>();
  int fetches;
  int mutations;
  RuntimeException failNext;
  RuntimeException failNextFetch;
  Runnable duringMutation;
  private int seq;

  @Override
  public IdentifierStatusView fetch(String propertyId) {
    fetches++;
    maybeFail();
    RuntimeException e = failNextFetch;
    failNextFetch = null;
    if (e != null) throw e;
    return copy(current(propertyId));
  }

  @Override
  public IdentifierStatusView generate(String propertyId, PrivacySettingsPatch overrides) {
    mutate();
    String token = "HOME-" + (++seq);
    IdentifierStatusView next =
        IdentifierStatusView.builder()
            .masterIdentifier(token)
            .status(IdentifierStatus.ACTIVE)
            .publicVisibility(current(propertyId).getPublicVisibility().merge(overrides))
            .publicUrl("https://vault.example.com/property/public/" + token)
            .build();
    state.put(propertyId, next);
    return copy(next);
  }

  @Override
  public IdentifierStatusView updatePrivacy(String propertyId, PrivacySettingsPatch patch) {
    mutate();
    IdentifierStatusView cur = current(propertyId);
    if (cur.getStatus() == IdentifierStatus.REVOKED) throw ConflictException.revoked();
    IdentifierStatusView next =
        cur.toBuilder().publicVisibility(cur.getPublicVisibility().merge(patch)).build();
    state.put(propertyId, next);
    return copy(next);
  }

  @Override
  public void revoke(String propertyId) {
    mutate();
    IdentifierStatusView cur = current(propertyId);
    if (cur.getStatus() != IdentifierStatus.ACTIVE) return;
    state.put(
        propertyId,
        cur.toBuilder()
            .status(IdentifierStatus.REVOKED)
            .revokedAt(Instant.parse("2025-03-01T12:00:00Z"))
            .publicUrl(null)
            .build());
  }

  /** Revokes behind the client's back, as another device would. */
  void revokeElsewhere(String propertyId) {
    Runnable hook = duringMutation;
    duringMutation = null;
    revoke(propertyId);
    mutations--;
    duringMutation = hook;
  }

  private IdentifierStatusView current(String propertyId) {
    return state.getOrDefault(
        propertyId,
        IdentifierStatusView.builder()
            .status(IdentifierStatus.UNISSUED)
            .publicVisibility(PrivacySettings.defaults())
            .build());
  }

  private void mutate() {
    mutations++;
    if (duringMutation != null) {
      Runnable hook = duringMutation;
      duringMutation = null;
      hook.run();
    }
    maybeFail();
  }

  private void maybeFail() {
    RuntimeException e = failNext;
    failNext = null;
    if (e != null) throw e;
  }

  private static IdentifierStatusView copy(IdentifierStatusView v) {
    return v.toBuilder().publicVisibility(v.getPublicVisibility().toBuilder().build()).build();
  }
}
