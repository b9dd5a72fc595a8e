package com.servicevault.identifier.app.api;

import com.servicevault.identifier.app.config.OwnerSessionFilter;
import com.servicevault.identifier.app.model.Asset;
import com.servicevault.identifier.app.model.AssetType;
import com.servicevault.identifier.app.model.ProjectedView;
import com.servicevault.identifier.app.service.AssetClassificationService;
import com.servicevault.identifier.app.service.PropertyViewService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/** Owner views of a property's history and the asset classification switch. */
@Validated
@RestController
@RequestMapping("/properties")
@RequiredArgsConstructor
public class PropertyController {

  private final PropertyViewService views;
  private final AssetClassificationService classification;

  @GetMapping(path = "/{propertyId}/history", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ProjectedView> history(
      @PathVariable("propertyId") String propertyId,
      @RequestAttribute(OwnerSessionFilter.USER_ID) String userId) {
    return ResponseEntity.ok(views.ownerView(propertyId, userId));
  }

  @PutMapping(
      path = "/{propertyId}/assets/{assetId}/classification",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Asset> classify(
      @PathVariable("propertyId") String propertyId,
      @PathVariable("assetId") String assetId,
      @RequestAttribute(OwnerSessionFilter.USER_ID) String userId,
      @Valid @RequestBody ClassificationRequest request) {
    return ResponseEntity.ok(
        classification.reclassify(propertyId, assetId, userId, request.getAssetType()));
  }

  // ------------------------------------------------------------
  // DTOs
  // ------------------------------------------------------------
  @Data
  public static class ClassificationRequest {
    @NotNull private AssetType assetType;
  }
}
