package com.servicevault.identifier.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A public token resolved to its property and the property's active identifier record. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResolvedIdentifier {

  private Property property;
  private IdentifierRecord identifier;
}
