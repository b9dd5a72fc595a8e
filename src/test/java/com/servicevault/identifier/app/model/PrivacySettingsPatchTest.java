package com.servicevault.identifier.app.model;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicevault.identifier.app.exception.ValidationException;
import org.junit.jupiter.api.Test;

class PrivacySettingsPatchTest {

  private final ObjectMapper om = new ObjectMapper();

  @Test
  void parsesKnownBooleanKeys() throws Exception {
    PrivacySettingsPatch patch = PrivacySettingsPatch.parse(json("{\"showCosts\":true}"));

    assertEquals(Boolean.TRUE, patch.getShowCosts());
    assertNull(patch.getShowFullAddress());
    assertFalse(patch.isEmpty());
  }

  @Test
  void missingOrNullMeansNoChanges() throws Exception {
    assertTrue(PrivacySettingsPatch.parse(null).isEmpty());
    assertTrue(PrivacySettingsPatch.parse(json("null")).isEmpty());
    assertTrue(PrivacySettingsPatch.parse(json("{}")).isEmpty());
    assertTrue(PrivacySettingsPatch.parse(json("{\"showCosts\":null}")).isEmpty());
  }

  @Test
  void rejectsUnknownKeys() {
    ValidationException e =
        assertThrows(
            ValidationException.class,
            () -> PrivacySettingsPatch.parse(json("{\"showEverything\":true}")));
    assertEquals("Invalid privacy settings keys", e.getMessage());
  }

  @Test
  void rejectsNonBooleanValues() {
    ValidationException e =
        assertThrows(
            ValidationException.class,
            () -> PrivacySettingsPatch.parse(json("{\"showDocuments\":\"true\"}")));
    assertEquals("Privacy setting showDocuments must be boolean", e.getMessage());

    assertThrows(
        ValidationException.class, () -> PrivacySettingsPatch.parse(json("{\"showCosts\":1}")));
    assertThrows(ValidationException.class, () -> PrivacySettingsPatch.parse(json("[true]")));
  }

  @Test
  void mergeOnlyTouchesSuppliedFields() {
    PrivacySettingsPatch patch =
        PrivacySettingsPatch.builder().showFullAddress(true).showContractors(false).build();
    PrivacySettings merged = PrivacySettings.defaults().merge(patch);

    assertTrue(merged.isShowFullAddress());
    assertFalse(merged.isShowContractors());
    assertFalse(merged.isShowDocuments());
    assertFalse(merged.isShowCosts());
    // the receiver is not modified
    assertFalse(PrivacySettings.defaults().isShowFullAddress());
  }

  @Test
  void withFlipsOneField() {
    PrivacySettings base = PrivacySettings.defaults();

    for (PrivacyField field : PrivacyField.values()) {
      PrivacySettings flipped = base.with(field, !base.get(field));
      assertEquals(!base.get(field), flipped.get(field), field.getKey());
    }
  }

  private JsonNode json(String s) throws Exception {
    return om.readTree(s);
  }
}
