package com.servicevault.identifier.app.service;

import com.servicevault.identifier.app.exception.NotFoundException;
import com.servicevault.identifier.app.exception.ValidationException;
import com.servicevault.identifier.app.model.Asset;
import com.servicevault.identifier.app.model.AssetType;
import com.servicevault.identifier.app.repository.PropertyCatalog;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

/** Owner-only change of an asset's visibility classification. */
@Log4j2
@Service
@RequiredArgsConstructor
public class AssetClassificationService {

  private final PropertyCatalog catalog;
  private final OwnershipGuard ownershipGuard;

  public Asset reclassify(String propertyId, String assetId, String userId, AssetType assetType) {
    if (assetType == null) {
      throw new ValidationException("assetType must be INFRASTRUCTURE or PERSONAL");
    }
    ownershipGuard.requireOwned(propertyId, userId);

    Asset asset =
        catalog
            .findAsset(assetId)
            .filter(a -> Objects.equals(a.getPropertyId(), propertyId))
            .orElseThrow(() -> new NotFoundException("Asset not found: " + assetId));
    if (asset.effectiveType() == assetType && asset.getAssetType() != null) {
      return asset;
    }

    Asset updated = catalog.updateAssetType(assetId, assetType);
    log.info(
        "asset.reclassify propertyId={} assetId={} from={} to={}",
        propertyId,
        assetId,
        asset.effectiveType(),
        assetType);
    return updated;
  }
}
