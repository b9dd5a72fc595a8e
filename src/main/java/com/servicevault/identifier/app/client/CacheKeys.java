package com.servicevault.identifier.app.client;

/** Keys of the read views a client keeps cached. */
public final class CacheKeys {

  /** Dashboard aggregate carrying the "QR active" flag of every property. */
  public static final String DASHBOARD = "/dashboard/homeowner";

  private CacheKeys() {}

  public static String identifier(String propertyId) {
    return "/identifier/" + propertyId;
  }
}
