package com.servicevault.identifier.app.api;

import com.servicevault.identifier.app.model.ProjectedAsset;
import com.servicevault.identifier.app.model.ProjectedView;
import com.servicevault.identifier.app.service.PropertyViewService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Anonymous QR scan endpoints. Responses are never cached so a revoke or a settings change shows
 * on the next scan.
 */
@RestController
@RequestMapping("/public")
@RequiredArgsConstructor
public class PublicViewController {

  private final PropertyViewService views;

  @GetMapping(path = "/property/{token}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ProjectedView> property(@PathVariable("token") String token) {
    return ResponseEntity.ok()
        .cacheControl(CacheControl.noStore())
        .body(views.publicPropertyView(token));
  }

  @GetMapping(path = "/asset/{assetId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ProjectedAsset> asset(@PathVariable("assetId") String assetId) {
    return ResponseEntity.ok()
        .cacheControl(CacheControl.noStore())
        .body(views.publicAssetView(assetId));
  }
}
