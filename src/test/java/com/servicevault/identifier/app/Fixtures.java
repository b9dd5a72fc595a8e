package com.servicevault.identifier.app;

import com.servicevault.identifier.app.model.Address;
import com.servicevault.identifier.app.model.Asset;
import com.servicevault.identifier.app.model.AssetEvent;
import com.servicevault.identifier.app.model.AssetType;
import com.servicevault.identifier.app.model.IdentifierRecord;
import com.servicevault.identifier.app.model.PrivacySettings;
import com.servicevault.identifier.app.model.Property;
import com.servicevault.identifier.app.model.PropertyDocument;
import com.servicevault.identifier.app.model.PropertySnapshot;
import com.servicevault.identifier.app.repository.memory.InMemoryPropertyCatalog;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Test data: one property with an infrastructure asset (full history), a personal asset (full
 * history), an unclassified asset without history and one property-level document.
 */
public final class Fixtures {

  public static final String OWNER = "owner-1";
  public static final String STRANGER = "owner-2";

  public static final String INFRA = "asset-water-heater";
  public static final String PERSONAL = "asset-bike";
  public static final String LEGACY = "asset-roof";

  private Fixtures() {}

  public static Property property(String id) {
    return Property.builder()
        .id(id)
        .ownerId(OWNER)
        .name("Maple Street House")
        .propertyType("SINGLE_FAMILY")
        .address(
            Address.builder()
                .line1("42 Maple Street")
                .city("Springfield")
                .state("IL")
                .postalCode("62704")
                .country("US")
                .build())
        .build();
  }

  public static PropertySnapshot snapshot(String propertyId) {
    return snapshot(propertyId, AssetType.INFRASTRUCTURE);
  }

  /** @param infraType classification given to the asset that is normally infrastructure */
  public static PropertySnapshot snapshot(String propertyId, AssetType infraType) {
    return PropertySnapshot.builder()
        .property(property(propertyId))
        .asset(
            Asset.builder()
                .id(propertyId + ":" + INFRA)
                .propertyId(propertyId)
                .name("Water Heater")
                .category("PLUMBING")
                .brand("Rheem")
                .installedAt(Instant.parse("2021-04-12T15:00:00Z"))
                .status("ACTIVE")
                .assetType(infraType)
                .installerId("contractor-acme")
                .purchasePrice(new BigDecimal("1450.00"))
                .build())
        .asset(
            Asset.builder()
                .id(propertyId + ":" + PERSONAL)
                .propertyId(propertyId)
                .name("Road Bike")
                .category("PERSONAL_ITEM")
                .assetType(AssetType.PERSONAL)
                .purchasePrice(new BigDecimal("2100.00"))
                .build())
        .asset(
            Asset.builder()
                .id(propertyId + ":" + LEGACY)
                .propertyId(propertyId)
                .name("Roof")
                .category("STRUCTURE")
                .build())
        .event(
            AssetEvent.builder()
                .id(propertyId + ":event-install")
                .assetId(propertyId + ":" + INFRA)
                .type("INSTALLED")
                .data(Map.of("notes", "Replaced tank"))
                .createdBy("contractor-acme")
                .amount(new BigDecimal("350.00"))
                .createdAt(Instant.parse("2021-04-12T17:00:00Z"))
                .build())
        .event(
            AssetEvent.builder()
                .id(propertyId + ":event-service")
                .assetId(propertyId + ":" + INFRA)
                .type("SERVICED")
                .createdBy("contractor-acme")
                .amount(new BigDecimal("120.00"))
                .createdAt(Instant.parse("2024-02-01T10:00:00Z"))
                .build())
        .event(
            AssetEvent.builder()
                .id(propertyId + ":event-bike")
                .assetId(propertyId + ":" + PERSONAL)
                .type("SERVICED")
                .createdBy("bike-shop")
                .amount(new BigDecimal("80.00"))
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build())
        .document(
            PropertyDocument.builder()
                .id(propertyId + ":doc-warranty")
                .propertyId(propertyId)
                .assetId(propertyId + ":" + INFRA)
                .type("WARRANTY")
                .title("Water heater warranty")
                .path("documents/warranty.pdf")
                .uploadedBy("contractor-acme")
                .amount(new BigDecimal("99.00"))
                .issueDate(LocalDate.parse("2021-04-12"))
                .uploadedAt(Instant.parse("2021-04-13T09:00:00Z"))
                .build())
        .document(
            PropertyDocument.builder()
                .id(propertyId + ":doc-bike")
                .propertyId(propertyId)
                .assetId(propertyId + ":" + PERSONAL)
                .type("RECEIPT")
                .title("Bike receipt")
                .path("documents/bike.pdf")
                .uploadedBy(OWNER)
                .amount(new BigDecimal("2100.00"))
                .uploadedAt(Instant.parse("2023-06-01T12:00:00Z"))
                .build())
        .document(
            PropertyDocument.builder()
                .id(propertyId + ":doc-inspection")
                .propertyId(propertyId)
                .type("INSPECTION")
                .title("Home inspection")
                .path("documents/inspection.pdf")
                .uploadedBy("inspector-jane")
                .amount(new BigDecimal("450.00"))
                .uploadedAt(Instant.parse("2020-08-21T16:00:00Z"))
                .build())
        .build();
  }

  /** Loads {@link #snapshot(String)} into the catalog. */
  public static void seed(InMemoryPropertyCatalog catalog, String propertyId) {
    PropertySnapshot s = snapshot(propertyId);
    catalog.putProperty(s.getProperty());
    s.getAssets().forEach(catalog::putAsset);
    s.getEvents().forEach(catalog::putEvent);
    s.getDocuments().forEach(catalog::putDocument);
  }

  public static IdentifierRecord active(String propertyId, String token, PrivacySettings s) {
    Instant issued = Instant.parse("2025-01-01T00:00:00Z");
    return IdentifierRecord.builder()
        .propertyId(propertyId)
        .token(token)
        .issuedAt(issued)
        .privacySettings(s)
        .updatedAt(issued)
        .build();
  }

  public static PrivacySettings settings(int mask) {
    return PrivacySettings.builder()
        .showFullAddress((mask & 1) != 0)
        .showContractors((mask & 2) != 0)
        .showDocuments((mask & 4) != 0)
        .showCosts((mask & 8) != 0)
        .build();
  }
}
