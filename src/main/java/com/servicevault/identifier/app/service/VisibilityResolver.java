package com.servicevault.identifier.app.service;

import com.servicevault.identifier.app.exception.ForbiddenException;
import com.servicevault.identifier.app.exception.NotFoundException;
import com.servicevault.identifier.app.model.Address;
import com.servicevault.identifier.app.model.Asset;
import com.servicevault.identifier.app.model.AssetEvent;
import com.servicevault.identifier.app.model.IdentifierRecord;
import com.servicevault.identifier.app.model.PrivacySettings;
import com.servicevault.identifier.app.model.ProjectedAsset;
import com.servicevault.identifier.app.model.ProjectedView;
import com.servicevault.identifier.app.model.ProjectedView.AssetView;
import com.servicevault.identifier.app.model.ProjectedView.DocumentView;
import com.servicevault.identifier.app.model.ProjectedView.EventView;
import com.servicevault.identifier.app.model.ProjectedView.PropertyView;
import com.servicevault.identifier.app.model.ProjectedView.TimelineEntry;
import com.servicevault.identifier.app.model.Property;
import com.servicevault.identifier.app.model.PropertyDocument;
import com.servicevault.identifier.app.model.PropertySnapshot;
import com.servicevault.identifier.app.model.Viewer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the projection of a property for a viewer. Pure: no I/O, no clock, no shared state.
 *
 * <p>Owner and public requests run through the same projection code, differing only in the
 * {@link Disclosure} they are given:
 *
 * <ul>
 *   <li>owner - every asset (tagged with its classification), every field, editable settings
 *   <li>public - a valid active token is required; INFRASTRUCTURE assets only; each privacy flag
 *       removes its whole field group
 * </ul>
 *
 * <p>Events and documents attached to an undisclosed asset are never disclosed either.
 */
public class VisibilityResolver {

  private static final Comparator<Instant> NEWEST_FIRST =
      Comparator.nullsLast(Comparator.reverseOrder());

  /**
   * Resolves the property view for {@code viewer}.
   *
   * @param identifier the property's identifier record, {@code null} when none exists
   * @throws ForbiddenException an owner session for another account's property
   * @throws NotFoundException public caller whose token is unknown, revoked or foreign
   */
  public ProjectedView resolve(
      Viewer viewer, PropertySnapshot snapshot, IdentifierRecord identifier) {
    Objects.requireNonNull(viewer, "viewer");
    Objects.requireNonNull(snapshot, "snapshot");
    Property property = snapshot.getProperty();

    if (viewer.getKind() == Viewer.Kind.OWNER) {
      requireOwner(viewer, property);
      PrivacySettings settings =
          identifier == null ? PrivacySettings.defaults() : identifier.effectiveSettings();
      ProjectedView view = project(snapshot, Disclosure.owner());
      view.setPrivacySettings(settings);
      view.setSettingsEditable(identifier == null || !identifier.isRevoked());
      return view;
    }

    if (!tokenGrantsAccess(viewer.getToken(), property, identifier)) {
      throw NotFoundException.notAccessible();
    }
    return project(snapshot, Disclosure.publicWith(identifier.effectiveSettings()));
  }

  /**
   * Resolves a single asset. Public callers get the owning property's current privacy settings
   * applied; a PERSONAL or unknown asset is the same not-found.
   */
  public ProjectedAsset resolveAsset(
      Viewer viewer, PropertySnapshot snapshot, String assetId, IdentifierRecord identifier) {
    Objects.requireNonNull(viewer, "viewer");
    Objects.requireNonNull(snapshot, "snapshot");

    Disclosure disclosure;
    if (viewer.getKind() == Viewer.Kind.OWNER) {
      requireOwner(viewer, snapshot.getProperty());
      disclosure = Disclosure.owner();
    } else {
      PrivacySettings settings =
          identifier == null ? PrivacySettings.defaults() : identifier.effectiveSettings();
      disclosure = Disclosure.publicWith(settings);
    }

    Asset asset =
        snapshot.getAssets().stream()
            .filter(a -> Objects.equals(a.getId(), assetId))
            .filter(disclosure::includes)
            .findFirst()
            .orElseThrow(NotFoundException::notAccessible);

    PropertySnapshot single =
        PropertySnapshot.builder()
            .property(snapshot.getProperty())
            .asset(asset)
            .events(
                snapshot.getEvents().stream()
                    .filter(e -> Objects.equals(e.getAssetId(), assetId))
                    .collect(Collectors.toList()))
            .documents(
                snapshot.getDocuments().stream()
                    .filter(d -> Objects.equals(d.getAssetId(), assetId))
                    .collect(Collectors.toList()))
            .build();

    ProjectedView view = project(single, disclosure);
    return ProjectedAsset.builder()
        .viewer(viewer.getKind())
        .asset(view.getAssets().get(0))
        .documents(view.getDocuments())
        .timeline(view.getTimeline())
        .build();
  }

  /** True only for the current, active token of this very property. */
  public static boolean tokenGrantsAccess(
      String token, Property property, IdentifierRecord identifier) {
    return token != null
        && property != null
        && identifier != null
        && identifier.isActive()
        && token.equals(identifier.getToken())
        && Objects.equals(property.getId(), identifier.getPropertyId());
  }

  // ------------------ projection ------------------

  private ProjectedView project(PropertySnapshot snapshot, Disclosure disclosure) {
    List<Asset> assets =
        snapshot.getAssets().stream().filter(disclosure::includes).collect(Collectors.toList());
    Set<String> assetIds = assets.stream().map(Asset::getId).collect(Collectors.toSet());

    List<EventView> events =
        snapshot.getEvents().stream()
            .filter(e -> assetIds.contains(e.getAssetId()))
            .map(e -> toEventView(e, disclosure))
            .sorted(Comparator.comparing(EventView::getCreatedAt, NEWEST_FIRST))
            .collect(Collectors.toList());
    Map<String, List<EventView>> historyByAsset =
        events.stream().collect(Collectors.groupingBy(EventView::getAssetId));

    List<AssetView> assetViews =
        assets.stream()
            .map(a -> toAssetView(a, historyByAsset.getOrDefault(a.getId(), List.of()), disclosure))
            .collect(Collectors.toList());

    List<DocumentView> documents =
        !disclosure.documents
            ? List.of()
            : snapshot.getDocuments().stream()
                .filter(d -> d.getAssetId() == null || assetIds.contains(d.getAssetId()))
                .map(d -> toDocumentView(d, disclosure))
                .sorted(Comparator.comparing(DocumentView::getUploadedAt, NEWEST_FIRST))
                .collect(Collectors.toList());

    return ProjectedView.builder()
        .viewer(disclosure.owner ? Viewer.Kind.OWNER : Viewer.Kind.PUBLIC)
        .property(toPropertyView(snapshot.getProperty(), disclosure))
        .assets(assetViews)
        .documents(documents)
        .timeline(timeline(events, documents))
        .build();
  }

  private PropertyView toPropertyView(Property p, Disclosure disclosure) {
    Address address = p.getAddress();
    if (address != null && !disclosure.fullAddress) {
      address = address.cityAndState();
    }
    return PropertyView.builder()
        .id(p.getId())
        .name(p.getName())
        .type(p.getPropertyType())
        .address(address == null ? null : address.toBuilder().build())
        .build();
  }

  private AssetView toAssetView(Asset a, List<EventView> history, Disclosure disclosure) {
    return AssetView.builder()
        .id(a.getId())
        .name(a.getName())
        .category(a.getCategory())
        .brand(a.getBrand())
        .model(a.getModel())
        .serial(a.getSerial())
        .installedAt(a.getInstalledAt())
        .status(a.getStatus())
        .assetType(disclosure.owner ? a.effectiveType() : null)
        .installerId(disclosure.contractors ? a.getInstallerId() : null)
        .purchasePrice(disclosure.costs ? a.getPurchasePrice() : null)
        .history(history)
        .build();
  }

  private EventView toEventView(AssetEvent e, Disclosure disclosure) {
    return EventView.builder()
        .id(e.getId())
        .assetId(e.getAssetId())
        .type(e.getType())
        .data(e.getData() == null ? null : new LinkedHashMap<>(e.getData()))
        .createdBy(disclosure.contractors ? e.getCreatedBy() : null)
        .amount(disclosure.costs ? e.getAmount() : null)
        .createdAt(e.getCreatedAt())
        .build();
  }

  private DocumentView toDocumentView(PropertyDocument d, Disclosure disclosure) {
    return DocumentView.builder()
        .id(d.getId())
        .assetId(d.getAssetId())
        .type(d.getType())
        .title(d.getTitle())
        .uploadedBy(disclosure.contractors ? d.getUploadedBy() : null)
        .amount(disclosure.costs ? d.getAmount() : null)
        .issueDate(d.getIssueDate())
        .expiryDate(d.getExpiryDate())
        .uploadedAt(d.getUploadedAt())
        .build();
  }

  // Built from the already-filtered lists so it cannot disclose anything they don't.
  private List<TimelineEntry> timeline(List<EventView> events, List<DocumentView> documents) {
    List<TimelineEntry> entries = new ArrayList<>(events.size() + documents.size());
    for (EventView e : events) {
      entries.add(
          TimelineEntry.builder()
              .kind(TimelineEntry.Kind.EVENT)
              .date(e.getCreatedAt())
              .refId(e.getId())
              .assetId(e.getAssetId())
              .label(e.getType())
              .build());
    }
    for (DocumentView d : documents) {
      entries.add(
          TimelineEntry.builder()
              .kind(TimelineEntry.Kind.DOCUMENT)
              .date(d.getUploadedAt())
              .refId(d.getId())
              .assetId(d.getAssetId())
              .label(d.getTitle())
              .build());
    }
    entries.sort(Comparator.comparing(TimelineEntry::getDate, NEWEST_FIRST));
    return entries;
  }

  private static void requireOwner(Viewer viewer, Property property) {
    if (!viewer.isOwnerOf(property)) {
      throw ForbiddenException.notOwner(property == null ? null : property.getId());
    }
  }

  /** Which field groups a projection keeps. */
  private static final class Disclosure {
    private final boolean owner;
    private final boolean fullAddress;
    private final boolean contractors;
    private final boolean documents;
    private final boolean costs;

    private Disclosure(
        boolean owner, boolean fullAddress, boolean contractors, boolean documents, boolean costs) {
      this.owner = owner;
      this.fullAddress = fullAddress;
      this.contractors = contractors;
      this.documents = documents;
      this.costs = costs;
    }

    static Disclosure owner() {
      return new Disclosure(true, true, true, true, true);
    }

    static Disclosure publicWith(PrivacySettings s) {
      return new Disclosure(
          false,
          s.isShowFullAddress(),
          s.isShowContractors(),
          s.isShowDocuments(),
          s.isShowCosts());
    }

    boolean includes(Asset asset) {
      return owner || asset.effectiveType().isDisclosable();
    }
  }
}
