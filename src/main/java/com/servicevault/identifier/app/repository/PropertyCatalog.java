package com.servicevault.identifier.app.repository;

import com.servicevault.identifier.app.model.Asset;
import com.servicevault.identifier.app.model.AssetType;
import com.servicevault.identifier.app.model.Property;
import com.servicevault.identifier.app.model.PropertySnapshot;
import java.util.Optional;

/**
 * Read access to property, asset, event and document records, which are owned by other
 * subsystems. The only write is the owner's change of an asset's classification.
 */
public interface PropertyCatalog {

  Optional<Property> findProperty(String propertyId);

  Optional<Asset> findAsset(String assetId);

  /** Property with all of its assets, events and documents. */
  Optional<PropertySnapshot> loadSnapshot(String propertyId);

  Asset updateAssetType(String assetId, AssetType assetType);
}
