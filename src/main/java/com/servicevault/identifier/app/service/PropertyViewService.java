package com.servicevault.identifier.app.service;

import com.servicevault.identifier.app.exception.ForbiddenException;
import com.servicevault.identifier.app.exception.NotFoundException;
import com.servicevault.identifier.app.model.Asset;
import com.servicevault.identifier.app.model.IdentifierRecord;
import com.servicevault.identifier.app.model.ProjectedAsset;
import com.servicevault.identifier.app.model.ProjectedView;
import com.servicevault.identifier.app.model.ProjectedView.DocumentView;
import com.servicevault.identifier.app.model.PropertyDocument;
import com.servicevault.identifier.app.model.PropertySnapshot;
import com.servicevault.identifier.app.model.ResolvedIdentifier;
import com.servicevault.identifier.app.model.Viewer;
import com.servicevault.identifier.app.repository.MasterIdentifierRepository;
import com.servicevault.identifier.app.repository.PropertyCatalog;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

/** Loads property data and runs it through the {@link VisibilityResolver} for each read path. */
@Log4j2
@Service
@RequiredArgsConstructor
public class PropertyViewService {

  private final PropertyCatalog catalog;
  private final MasterIdentifierRepository repository;
  private final IdentifierRegistryService registry;
  private final VisibilityResolver resolver;
  private final DocumentLinkSigner linkSigner;

  /**
   * Owner history view.
   *
   * @throws NotFoundException unknown property
   * @throws ForbiddenException property of another account
   */
  public ProjectedView ownerView(String propertyId, String userId) {
    PropertySnapshot snapshot =
        catalog.loadSnapshot(propertyId).orElseThrow(() -> NotFoundException.property(propertyId));
    IdentifierRecord record = repository.findByPropertyId(propertyId).orElse(null);

    ProjectedView view = resolver.resolve(Viewer.owner(userId), snapshot, record);
    attachLinks(view.getDocuments(), snapshot);
    log.debug("view.owner propertyId={} assets={}", propertyId, view.getAssets().size());
    return view;
  }

  /** Public QR scan of a property. Any failure is the same not-accessible response. */
  public ProjectedView publicPropertyView(String token) {
    ResolvedIdentifier resolved = registry.resolveToken(token);
    String propertyId = resolved.getProperty().getId();
    PropertySnapshot snapshot =
        catalog.loadSnapshot(propertyId).orElseThrow(NotFoundException::notAccessible);

    ProjectedView view =
        resolver.resolve(Viewer.anonymous(token), snapshot, resolved.getIdentifier());
    attachLinks(view.getDocuments(), snapshot);
    log.info(
        "view.public propertyId={} assets={} documents={}",
        propertyId,
        view.getAssets().size(),
        view.getDocuments().size());
    return view;
  }

  /** Public scan of a single asset sticker, filtered by the owning property's settings. */
  public ProjectedAsset publicAssetView(String assetId) {
    Asset asset = catalog.findAsset(assetId).orElseThrow(NotFoundException::notAccessible);
    PropertySnapshot snapshot =
        catalog.loadSnapshot(asset.getPropertyId()).orElseThrow(NotFoundException::notAccessible);
    IdentifierRecord record = repository.findByPropertyId(asset.getPropertyId()).orElse(null);

    ProjectedAsset view = resolver.resolveAsset(Viewer.anonymous(null), snapshot, assetId, record);
    attachLinks(view.getDocuments(), snapshot);
    log.info("view.public.asset assetId={} propertyId={}", assetId, asset.getPropertyId());
    return view;
  }

  private void attachLinks(List<DocumentView> documents, PropertySnapshot snapshot) {
    if (documents == null || documents.isEmpty()) return;
    Map<String, String> paths = new HashMap<>();
    for (PropertyDocument d : snapshot.getDocuments()) {
      if (d.getPath() != null) paths.put(d.getId(), d.getPath());
    }
    for (DocumentView d : documents) {
      String path = paths.get(d.getId());
      if (path != null) d.setDownloadUrl(linkSigner.downloadUrl(path));
    }
  }
}
