package com.servicevault.identifier.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A property owned by a single account. Property records belong to the property-management
 * subsystem; this service only reads them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Property {

  private String id;

  /** Account id of the owner. */
  private String ownerId;

  private String name;

  /** e.g. SINGLE_FAMILY, CONDO. */
  private String propertyType;

  private Address address;

  public boolean isOwnedBy(String userId) {
    return ownerId != null && ownerId.equals(userId);
  }
}
