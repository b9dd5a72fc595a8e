package com.servicevault.identifier.app.client;

import static org.junit.jupiter.api.Assertions.*;

import com.servicevault.identifier.app.exception.ConflictException;
import com.servicevault.identifier.app.exception.ErrorCode;
import com.servicevault.identifier.app.exception.ValidationException;
import com.servicevault.identifier.app.model.IdentifierStatusView;
import com.servicevault.identifier.app.model.PrivacyField;
import com.servicevault.identifier.app.model.PrivacySettingsPatch;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IdentifierSynchronizerTest {

  private static final String P = "prop-1";

  private FakeIdentifierApi api;
  private ClientViewCache cache;
  private IdentifierSynchronizer sync;
  private final List<IdentifierSurface> published = new ArrayList<>();

  @BeforeEach
  void setUp() {
    api = new FakeIdentifierApi();
    cache = new ClientViewCache();
    sync = new IdentifierSynchronizer(api, cache);
    sync.addListener(published::add);
  }

  @Test
  void firstLoadShowsLoadingThenUnissued() {
    IdentifierSurface s = sync.load(P);

    assertEquals(SurfacePhase.LOADING, published.get(0).getPhase());
    assertEquals(SurfacePhase.UNISSUED, s.getPhase());
    assertTrue(s.controlsEnabled());
    assertFalse(s.publicLinkShown());
  }

  @Test
  void secondLoadIsServedFromCache() {
    sync.load(P);
    sync.load(P);

    assertEquals(1, api.fetches);
  }

  @Test
  void refreshOnFocusAlwaysRefetches() {
    sync.load(P);
    sync.refreshOnFocus(P);

    assertEquals(2, api.fetches);
  }

  @Test
  void generatePassesThroughMutatingAndInvalidatesDashboard() {
    sync.load(P);
    cache.put(CacheKeys.DASHBOARD, "stale dashboard");

    IdentifierSurface s = sync.generate(P, PrivacySettingsPatch.empty());

    assertTrue(
        published.stream()
            .anyMatch(
                p ->
                    p.getPhase() == SurfacePhase.MUTATING
                        && p.getPendingAction() == PendingAction.GENERATE
                        && !p.controlsEnabled()));
    assertEquals(SurfacePhase.ACTIVE, s.getPhase());
    assertTrue(s.publicLinkShown());
    assertEquals("HOME-1", s.getIdentifier().getMasterIdentifier());
    assertFalse(cache.contains(CacheKeys.DASHBOARD));
    assertEquals(2, api.fetches);
  }

  @Test
  void failedGenerateRestoresPreviousSurfaceWithError() {
    sync.load(P);
    api.failNext = new ValidationException("boom");

    IdentifierSurface s = sync.generate(P, null);

    assertEquals(SurfacePhase.UNISSUED, s.getPhase());
    assertNull(s.getPendingAction());
    assertEquals("boom", s.getError());
    assertEquals(ErrorCode.VALIDATION_ERROR, s.getErrorCode());
  }

  @Test
  void secondDestructiveActionWhilePendingIsRejected() {
    sync.load(P);
    List<IdentifierSurface> nested = new ArrayList<>();
    api.duringMutation = () -> nested.add(sync.revoke(P));

    sync.generate(P, null);

    assertEquals(1, api.mutations);
    assertEquals(IdentifierSynchronizer.BUSY, nested.get(0).getError());
    assertEquals(SurfacePhase.ACTIVE, sync.surface(P).getPhase());
  }

  @Test
  void toggleIsOptimisticThenConfirmed() {
    sync.load(P);
    sync.generate(P, null);
    published.clear();

    IdentifierSurface s = sync.togglePrivacy(P, PrivacyField.SHOW_COSTS, true);

    IdentifierSurface optimistic = published.get(0);
    assertTrue(optimistic.getSettings().isShowCosts());
    assertFalse(optimistic.getLastGoodSettings().isShowCosts());
    assertEquals(PendingAction.PRIVACY_UPDATE, optimistic.getPendingAction());
    assertTrue(optimistic.controlsEnabled());

    assertTrue(s.getSettings().isShowCosts());
    assertNull(s.getPendingAction());
    assertNull(s.getError());
  }

  @Test
  void failedToggleRollsBack() {
    sync.load(P);
    sync.generate(P, null);
    api.failNext = new ValidationException("nope");

    IdentifierSurface s = sync.togglePrivacy(P, PrivacyField.SHOW_DOCUMENTS, true);

    assertFalse(s.getSettings().isShowDocuments());
    assertNull(s.getLastGoodSettings());
    assertEquals("nope", s.getError());
    assertEquals(SurfacePhase.ACTIVE, s.getPhase());
  }

  @Test
  void toggleAfterRevokeElsewhereReloadsAndAsksToRegenerate() {
    sync.load(P);
    sync.generate(P, null);
    api.revokeElsewhere(P);

    IdentifierSurface s = sync.togglePrivacy(P, PrivacyField.SHOW_COSTS, true);

    assertEquals(SurfacePhase.REVOKED, s.getPhase());
    assertFalse(s.getSettings().isShowCosts());
    assertTrue(s.isRegenerateRequired());
    assertEquals(ErrorCode.CONFLICT, s.getErrorCode());
    assertEquals(ConflictException.REGENERATE_TO_MODIFY, s.getError());
    assertFalse(s.controlsEnabled());
    assertFalse(s.publicLinkShown());
  }

  @Test
  void toggleWhileRevokedNeverCallsServer() {
    sync.load(P);
    sync.generate(P, null);
    sync.revoke(P);
    int before = api.mutations;

    IdentifierSurface s = sync.togglePrivacy(P, PrivacyField.SHOW_FULL_ADDRESS, true);

    assertEquals(before, api.mutations);
    assertTrue(s.isRegenerateRequired());
    assertFalse(s.getSettings().isShowFullAddress());
  }

  @Test
  void revokedPanelKeepsTokenButHidesLink() {
    sync.load(P);
    sync.generate(P, null);

    IdentifierSurface s = sync.revoke(P);

    IdentifierStatusView view = s.getIdentifier();
    assertEquals(SurfacePhase.REVOKED, s.getPhase());
    assertEquals("HOME-1", view.getMasterIdentifier());
    assertNotNull(view.getRevokedAt());
    assertFalse(s.publicLinkShown());
  }

  @Test
  void failedReloadAfterRevokeDropsSupersededView() {
    sync.load(P);
    sync.generate(P, null);
    api.duringMutation = () -> api.failNextFetch = new IllegalStateException("offline");

    IdentifierSurface s = sync.revoke(P);

    assertEquals(SurfacePhase.ERROR, s.getPhase());
    assertNull(s.getPendingAction());
    assertNull(s.getIdentifier());
    assertFalse(s.publicLinkShown());
    assertFalse(s.controlsEnabled());
    assertEquals("offline", s.getError());

    IdentifierSurface recovered = sync.refreshOnFocus(P);
    assertEquals(SurfacePhase.REVOKED, recovered.getPhase());
    assertNull(recovered.getError());
  }

  @Test
  void failedReloadAfterGenerateNeverStaysMutating() {
    sync.load(P);
    api.duringMutation = () -> api.failNextFetch = new IllegalStateException("offline");

    IdentifierSurface s = sync.generate(P, null);

    assertNotEquals(SurfacePhase.MUTATING, s.getPhase());
    assertNull(s.getIdentifier());
    assertEquals(s, sync.surface(P));
  }

  @Test
  void loadErrorKeepsLastGoodSurface() {
    sync.load(P);
    sync.generate(P, null);
    api.failNext = new IllegalStateException("offline");

    IdentifierSurface s = sync.refreshOnFocus(P);

    assertEquals(SurfacePhase.ACTIVE, s.getPhase());
    assertEquals("offline", s.getError());
    assertNull(s.getErrorCode());
  }
}
