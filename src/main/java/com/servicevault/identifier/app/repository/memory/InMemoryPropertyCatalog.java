package com.servicevault.identifier.app.repository.memory;

import com.servicevault.identifier.app.exception.NotFoundException;
import com.servicevault.identifier.app.model.Asset;
import com.servicevault.identifier.app.model.AssetEvent;
import com.servicevault.identifier.app.model.AssetType;
import com.servicevault.identifier.app.model.Property;
import com.servicevault.identifier.app.model.PropertyDocument;
import com.servicevault.identifier.app.model.PropertySnapshot;
import com.servicevault.identifier.app.repository.PropertyCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.log4j.Log4j2;

/** Catalog held in maps. Backs local runs and tests; may be seeded from a JSON fixture. */
@Log4j2
public class InMemoryPropertyCatalog implements PropertyCatalog {

  private final ConcurrentHashMap<String, Property> properties = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Asset> assets = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, AssetEvent> events = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, PropertyDocument> documents = new ConcurrentHashMap<>();

  /** Shape of the JSON seed file. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CatalogSeed {
    private List<Property> properties = new ArrayList<>();
    private List<Asset> assets = new ArrayList<>();
    private List<AssetEvent> events = new ArrayList<>();
    private List<PropertyDocument> documents = new ArrayList<>();
  }

  public void seed(CatalogSeed seed) {
    if (seed == null) return;
    Optional.ofNullable(seed.getProperties()).ifPresent(l -> l.forEach(this::putProperty));
    Optional.ofNullable(seed.getAssets()).ifPresent(l -> l.forEach(this::putAsset));
    Optional.ofNullable(seed.getEvents()).ifPresent(l -> l.forEach(this::putEvent));
    Optional.ofNullable(seed.getDocuments()).ifPresent(l -> l.forEach(this::putDocument));
    log.info(
        "catalog.seed properties={} assets={} events={} documents={}",
        properties.size(),
        assets.size(),
        events.size(),
        documents.size());
  }

  public void putProperty(Property property) {
    properties.put(property.getId(), property);
  }

  public void putAsset(Asset asset) {
    assets.put(asset.getId(), asset);
  }

  public void putEvent(AssetEvent event) {
    events.put(event.getId(), event);
  }

  public void putDocument(PropertyDocument document) {
    documents.put(document.getId(), document);
  }

  @Override
  public Optional<Property> findProperty(String propertyId) {
    if (propertyId == null) return Optional.empty();
    return Optional.ofNullable(properties.get(propertyId));
  }

  @Override
  public Optional<Asset> findAsset(String assetId) {
    if (assetId == null) return Optional.empty();
    return Optional.ofNullable(assets.get(assetId)).map(a -> a.toBuilder().build());
  }

  @Override
  public Optional<PropertySnapshot> loadSnapshot(String propertyId) {
    return findProperty(propertyId)
        .map(
            property -> {
              List<Asset> owned =
                  assets.values().stream()
                      .filter(a -> Objects.equals(a.getPropertyId(), propertyId))
                      .map(a -> a.toBuilder().build())
                      .collect(Collectors.toList());
              List<String> assetIds = owned.stream().map(Asset::getId).collect(Collectors.toList());
              return PropertySnapshot.builder()
                  .property(property)
                  .assets(owned)
                  .events(
                      events.values().stream()
                          .filter(e -> assetIds.contains(e.getAssetId()))
                          .collect(Collectors.toList()))
                  .documents(
                      documents.values().stream()
                          .filter(d -> Objects.equals(d.getPropertyId(), propertyId))
                          .collect(Collectors.toList()))
                  .build();
            });
  }

  @Override
  public Asset updateAssetType(String assetId, AssetType assetType) {
    Asset updated =
        assets.computeIfPresent(assetId, (id, a) -> a.toBuilder().assetType(assetType).build());
    if (updated == null) {
      throw new NotFoundException("Asset not found: " + assetId);
    }
    return updated.toBuilder().build();
  }
}
