package com.servicevault.identifier.app.service;

import com.servicevault.identifier.app.exception.ForbiddenException;
import com.servicevault.identifier.app.exception.NotFoundException;
import com.servicevault.identifier.app.model.Property;
import com.servicevault.identifier.app.repository.PropertyCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

/** Checks that an owner session is acting on its own property. */
@Log4j2
@Component
@RequiredArgsConstructor
public class OwnershipGuard {

  private final PropertyCatalog catalog;

  /**
   * @throws NotFoundException the property does not exist
   * @throws ForbiddenException the property belongs to another account
   */
  public Property requireOwned(String propertyId, String userId) {
    if (propertyId == null || propertyId.isBlank()) {
      throw NotFoundException.property(propertyId);
    }
    Property property =
        catalog.findProperty(propertyId).orElseThrow(() -> NotFoundException.property(propertyId));
    if (!property.isOwnedBy(userId)) {
      log.warn("ownership.denied propertyId={} userId={}", propertyId, userId);
      throw ForbiddenException.notOwner(propertyId);
    }
    return property;
  }
}
