package com.servicevault.identifier.app.client;

import com.servicevault.identifier.app.exception.ConflictException;
import com.servicevault.identifier.app.exception.ErrorCode;
import com.servicevault.identifier.app.exception.IdentifierException;
import com.servicevault.identifier.app.model.IdentifierStatus;
import com.servicevault.identifier.app.model.IdentifierStatusView;
import com.servicevault.identifier.app.model.PrivacyField;
import com.servicevault.identifier.app.model.PrivacySettings;
import com.servicevault.identifier.app.model.PrivacySettingsPatch;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.log4j.Log4j2;

/**
 * Keeps the owner's identifier panel consistent with the server.
 *
 * <ul>
 *   <li>privacy toggles are optimistic and roll back to the last good settings on failure
 *   <li>generate and revoke are never optimistic; the panel stays in MUTATING until they answer
 *   <li>every successful mutation invalidates the identifier and dashboard cache entries and
 *       re-fetches the identifier
 * </ul>
 *
 * <p>Calls are expected from a single UI thread and block until the server answers.
 */
@Log4j2
public class IdentifierSynchronizer {

  static final String BUSY = "Another change is still in progress";
  static final String CONTROLS_DISABLED = "Privacy settings cannot be changed right now";

  private final IdentifierApi api;
  private final ClientViewCache cache;
  private final Map<String, IdentifierSurface> surfaces = new ConcurrentHashMap<>();
  private final List<SurfaceListener> listeners = new CopyOnWriteArrayList<>();

  public IdentifierSynchronizer(IdentifierApi api, ClientViewCache cache) {
    this.api = Objects.requireNonNull(api, "api");
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  public void addListener(SurfaceListener listener) {
    listeners.add(listener);
  }

  public IdentifierSurface surface(String propertyId) {
    return surfaces.getOrDefault(propertyId, IdentifierSurface.loading(propertyId));
  }

  // ------------------ reads ------------------

  /** Loads through the cache; a cached entry is shown without a request. */
  public IdentifierSurface load(String propertyId) {
    IdentifierSurface before = surface(propertyId);
    if (before.getIdentifier() == null && !isPublishedLoading(propertyId)) {
      publish(IdentifierSurface.loading(propertyId));
    }
    try {
      IdentifierStatusView view =
          cache.get(
              CacheKeys.identifier(propertyId),
              IdentifierStatusView.class,
              () -> api.fetch(propertyId));
      return publish(settled(propertyId, view));
    } catch (RuntimeException e) {
      log.warn("sync.load failed propertyId={} err={}", propertyId, e.getMessage());
      IdentifierSurface failed =
          before.getIdentifier() == null
              ? IdentifierSurface.builder().propertyId(propertyId).phase(SurfacePhase.ERROR).build()
              : before;
      return publish(withError(failed.toBuilder().pendingAction(null).build(), e));
    }
  }

  /** Window focus or visibility change: always go back to the server. */
  public IdentifierSurface refreshOnFocus(String propertyId) {
    IdentifierSurface current = surface(propertyId);
    if (current.getPendingAction() != null) {
      // the pending mutation re-fetches when it completes
      return current;
    }
    cache.invalidate(CacheKeys.identifier(propertyId));
    return load(propertyId);
  }

  // ------------------ destructive mutations ------------------

  public IdentifierSurface generate(String propertyId, PrivacySettingsPatch overrides) {
    return destructive(
        propertyId, PendingAction.GENERATE, () -> api.generate(propertyId, overrides));
  }

  public IdentifierSurface revoke(String propertyId) {
    return destructive(propertyId, PendingAction.REVOKE, () -> api.revoke(propertyId));
  }

  private IdentifierSurface destructive(String propertyId, PendingAction action, Runnable call) {
    IdentifierSurface before = surface(propertyId);
    if (before.getPendingAction() != null) {
      return publish(before.toBuilder().error(BUSY).errorCode(null).build());
    }

    publish(
        before.toBuilder()
            .phase(SurfacePhase.MUTATING)
            .pendingAction(action)
            .error(null)
            .errorCode(null)
            .regenerateRequired(false)
            .build());
    try {
      call.run();
    } catch (RuntimeException e) {
      log.warn("sync.{} failed propertyId={} err={}", action, propertyId, e.getMessage());
      return publish(withError(before.toBuilder().pendingAction(null).build(), e));
    }

    log.info("sync.{} ok propertyId={}", action, propertyId);
    return reloadAfterMutation(propertyId);
  }

  // ------------------ optimistic privacy toggles ------------------

  /**
   * Flips one disclosure flag immediately, then reconciles with the server. A conflict means the
   * identifier was revoked elsewhere: the toggle rolls back, the panel reloads and asks the owner
   * to regenerate.
   */
  public IdentifierSurface togglePrivacy(String propertyId, PrivacyField field, boolean value) {
    IdentifierSurface before = surface(propertyId);
    if (!before.controlsEnabled() || before.getPendingAction() != null) {
      boolean revoked = before.getPhase() == SurfacePhase.REVOKED;
      return publish(
          before.toBuilder()
              .error(revoked ? ConflictException.REGENERATE_TO_MODIFY : CONTROLS_DISABLED)
              .errorCode(revoked ? ErrorCode.CONFLICT : null)
              .regenerateRequired(revoked)
              .build());
    }

    PrivacySettings lastGood = PrivacySettings.orDefaults(before.getSettings());
    IdentifierSurface optimistic =
        publish(
            before.toBuilder()
                .settings(lastGood.with(field, value))
                .lastGoodSettings(lastGood)
                .pendingAction(PendingAction.PRIVACY_UPDATE)
                .error(null)
                .errorCode(null)
                .regenerateRequired(false)
                .build());

    IdentifierStatusView echoed;
    try {
      echoed = api.updatePrivacy(propertyId, PrivacySettingsPatch.of(field, value));
    } catch (RuntimeException e) {
      log.warn(
          "sync.privacy failed propertyId={} field={} err={}", propertyId, field, e.getMessage());
      IdentifierSurface rolledBack =
          publish(
              withError(
                  optimistic.toBuilder()
                      .settings(lastGood)
                      .lastGoodSettings(null)
                      .pendingAction(null)
                      .build(),
                  e));
      if (!(e instanceof ConflictException)) return rolledBack;

      IdentifierSurface reloaded = reloadAfterMutation(propertyId);
      return publish(withError(reloaded, e));
    }

    publish(
        optimistic.toBuilder()
            .identifier(echoed)
            .settings(echoed == null ? optimistic.getSettings() : echoed.getPublicVisibility())
            .lastGoodSettings(null)
            .pendingAction(null)
            .build());
    invalidateAfterMutation(propertyId);
    return load(propertyId);
  }

  // ------------------ internals ------------------

  private void invalidateAfterMutation(String propertyId) {
    cache.invalidate(CacheKeys.identifier(propertyId), CacheKeys.DASHBOARD);
  }

  /**
   * Re-fetches after the server state changed. The pre-mutation view is dropped first, so a failed
   * re-fetch ends in ERROR instead of showing the superseded identifier.
   */
  private IdentifierSurface reloadAfterMutation(String propertyId) {
    invalidateAfterMutation(propertyId);
    publish(IdentifierSurface.loading(propertyId));
    return load(propertyId);
  }

  private boolean isPublishedLoading(String propertyId) {
    IdentifierSurface stored = surfaces.get(propertyId);
    return stored != null && stored.getPhase() == SurfacePhase.LOADING;
  }

  private static IdentifierSurface settled(String propertyId, IdentifierStatusView view) {
    SurfacePhase phase;
    IdentifierStatus status =
        view.getStatus() == null ? IdentifierStatus.UNISSUED : view.getStatus();
    switch (status) {
      case ACTIVE:
        phase = SurfacePhase.ACTIVE;
        break;
      case REVOKED:
        phase = SurfacePhase.REVOKED;
        break;
      default:
        phase = SurfacePhase.UNISSUED;
    }
    return IdentifierSurface.builder()
        .propertyId(propertyId)
        .phase(phase)
        .identifier(view)
        .settings(PrivacySettings.orDefaults(view.getPublicVisibility()))
        .build();
  }

  private static IdentifierSurface withError(IdentifierSurface surface, RuntimeException e) {
    IdentifierSurface.IdentifierSurfaceBuilder b = surface.toBuilder().error(e.getMessage());
    if (e instanceof IdentifierException) {
      b.errorCode(((IdentifierException) e).getCode());
    } else {
      b.errorCode(null);
    }
    b.regenerateRequired(
        e instanceof ConflictException && ((ConflictException) e).isRegenerateRequired());
    return b.build();
  }

  private IdentifierSurface publish(IdentifierSurface surface) {
    surfaces.put(surface.getPropertyId(), surface);
    for (SurfaceListener l : listeners) {
      l.onChange(surface);
    }
    return surface;
  }
}
