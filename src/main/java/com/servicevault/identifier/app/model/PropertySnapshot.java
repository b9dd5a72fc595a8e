package com.servicevault.identifier.app.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

/** Everything stored about one property, read once per request before projecting. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertySnapshot {

  private Property property;
  @Singular private List<Asset> assets;
  @Singular private List<AssetEvent> events;
  @Singular private List<PropertyDocument> documents;
}
