package com.servicevault.identifier.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Postal address of a property.
 *
 * <p>The public projection never returns a partially masked street line: either the full address
 * is disclosed or only {@code city} and {@code state} remain (see {@link #cityAndState()}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Address {

  /** Street address line. */
  private String line1;

  /** City or locality name. */
  private String city;

  /** State or region code. */
  private String state;

  /** ZIP or postal code. */
  private String postalCode;

  /** Country code. */
  private String country;

  /** Reduced form holding only city and state. */
  public Address cityAndState() {
    return Address.builder().city(city).state(state).build();
  }
}
