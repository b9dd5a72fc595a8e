package com.servicevault.identifier.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.servicevault.identifier.app.exception.ValidationException;
import java.util.Iterator;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial privacy settings: {@code null} means "leave unchanged". */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PrivacySettingsPatch {

  private Boolean showFullAddress;
  private Boolean showContractors;
  private Boolean showDocuments;
  private Boolean showCosts;

  public static PrivacySettingsPatch empty() {
    return new PrivacySettingsPatch();
  }

  public static PrivacySettingsPatch of(PrivacyField field, boolean value) {
    PrivacySettingsPatch patch = new PrivacySettingsPatch();
    patch.set(field, value);
    return patch;
  }

  public static PrivacySettingsPatch of(PrivacySettings settings) {
    return PrivacySettingsPatch.builder()
        .showFullAddress(settings.isShowFullAddress())
        .showContractors(settings.isShowContractors())
        .showDocuments(settings.isShowDocuments())
        .showCosts(settings.isShowCosts())
        .build();
  }

  /**
   * Strictly parses a JSON object. Only the four known keys are accepted and their values must be
   * JSON booleans; {@code "true"} strings and numbers are rejected rather than coerced.
   *
   * @param node JSON object, or {@code null}/JSON null for "no changes"
   * @throws ValidationException on unknown keys or non-boolean values
   */
  public static PrivacySettingsPatch parse(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) return empty();
    if (!node.isObject()) {
      throw new ValidationException("privacySettings must be an object");
    }

    PrivacySettingsPatch patch = new PrivacySettingsPatch();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> e = fields.next();
      PrivacyField field =
          PrivacyField.fromKey(e.getKey())
              .orElseThrow(() -> new ValidationException("Invalid privacy settings keys"));
      JsonNode value = e.getValue();
      if (value.isNull()) continue;
      if (!value.isBoolean()) {
        throw new ValidationException("Privacy setting " + field.getKey() + " must be boolean");
      }
      patch.set(field, value.booleanValue());
    }
    return patch;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return showFullAddress == null
        && showContractors == null
        && showDocuments == null
        && showCosts == null;
  }

  private void set(PrivacyField field, boolean value) {
    switch (field) {
      case SHOW_FULL_ADDRESS:
        showFullAddress = value;
        break;
      case SHOW_CONTRACTORS:
        showContractors = value;
        break;
      case SHOW_DOCUMENTS:
        showDocuments = value;
        break;
      case SHOW_COSTS:
        showCosts = value;
        break;
      default:
        throw new IllegalArgumentException("Unknown privacy field " + field);
    }
  }
}
