package com.servicevault.identifier.app.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An asset installed in or kept at a property.
 *
 * <ul>
 *   <li>{@code installerId} - contractor identity, disclosed only with {@code showContractors}
 *   <li>{@code purchasePrice} - monetary, disclosed only with {@code showCosts}
 *   <li>{@code assetType} - visibility classification, {@code null} reads as INFRASTRUCTURE
 * </ul>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Asset {

  private String id;
  private String propertyId;
  private String name;

  /** PLUMBING, ELECTRICAL, HVAC, APPLIANCE, ... */
  private String category;

  private String brand;
  private String model;
  private String serial;
  private Instant installedAt;
  private String status;
  private AssetType assetType;
  private String installerId;
  private BigDecimal purchasePrice;

  public AssetType effectiveType() {
    return AssetType.orDefault(assetType);
  }
}
