package com.servicevault.identifier.app.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.servicevault.identifier.app.config.OwnerSessionFilter;
import com.servicevault.identifier.app.exception.ValidationException;
import com.servicevault.identifier.app.model.IdentifierRecord;
import com.servicevault.identifier.app.model.IdentifierStatusView;
import com.servicevault.identifier.app.model.PrivacySettingsPatch;
import com.servicevault.identifier.app.service.IdentifierRegistryService;
import com.servicevault.identifier.app.service.PrivacySettingsService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Owner endpoints for a property's master identifier. */
@Log4j2
@RestController
@RequestMapping("/identifier")
@RequiredArgsConstructor
public class IdentifierController {

  private final IdentifierRegistryService registry;
  private final PrivacySettingsService privacySettings;

  // ------------------------------------------------------------
  // GET /identifier/{propertyId}
  // ------------------------------------------------------------
  @GetMapping(path = "/{propertyId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<IdentifierStatusView> get(
      @PathVariable("propertyId") String propertyId,
      @RequestAttribute(OwnerSessionFilter.USER_ID) String userId) {
    return ResponseEntity.ok(registry.status(propertyId, userId));
  }

  // ------------------------------------------------------------
  // POST /identifier/{propertyId}  {privacySettings?, regenerate?}
  // ------------------------------------------------------------
  @PostMapping(path = "/{propertyId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<IdentifierStatusView> update(
      @PathVariable("propertyId") String propertyId,
      @RequestAttribute(OwnerSessionFilter.USER_ID) String userId,
      @RequestBody(required = false) JsonNode body) {

    if (body != null && !body.isNull() && !body.isObject()) {
      throw new ValidationException("Request body must be a JSON object");
    }
    boolean regenerate = regenerateFlag(body);
    PrivacySettingsPatch patch =
        PrivacySettingsPatch.parse(body == null ? null : body.get("privacySettings"));

    if (regenerate) {
      log.info("identifier.regenerate propertyId={} overrides={}", propertyId, !patch.isEmpty());
      IdentifierRecord issued = registry.generate(propertyId, userId, patch);
      return ResponseEntity.ok(registry.describe(issued));
    }

    privacySettings.update(propertyId, userId, patch);
    return ResponseEntity.ok(registry.status(propertyId, userId));
  }

  // ------------------------------------------------------------
  // POST /identifier/{propertyId}/revoke
  // ------------------------------------------------------------
  @PostMapping(path = "/{propertyId}/revoke", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> revoke(
      @PathVariable("propertyId") String propertyId,
      @RequestAttribute(OwnerSessionFilter.USER_ID) String userId) {
    registry.revoke(propertyId, userId);
    return ResponseEntity.ok(Map.of("success", true));
  }

  private static boolean regenerateFlag(JsonNode body) {
    JsonNode node = body == null ? null : body.get("regenerate");
    if (node == null || node.isNull()) return false;
    if (!node.isBoolean()) {
      throw new ValidationException("regenerate must be boolean");
    }
    return node.booleanValue();
  }
}
