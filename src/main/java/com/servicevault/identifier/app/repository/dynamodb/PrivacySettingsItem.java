package com.servicevault.identifier.app.repository.dynamodb;

import com.servicevault.identifier.app.model.PrivacySettings;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/** Privacy flags stored as a nested map on the identifier record. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class PrivacySettingsItem {

  private Boolean showFullAddress;
  private Boolean showContractors;
  private Boolean showDocuments;
  private Boolean showCosts;

  public static PrivacySettingsItem from(PrivacySettings s) {
    if (s == null) return null;
    return PrivacySettingsItem.builder()
        .showFullAddress(s.isShowFullAddress())
        .showContractors(s.isShowContractors())
        .showDocuments(s.isShowDocuments())
        .showCosts(s.isShowCosts())
        .build();
  }

  /** Missing flags fall back to their default value. */
  public PrivacySettings toModel() {
    PrivacySettings d = PrivacySettings.defaults();
    return PrivacySettings.builder()
        .showFullAddress(showFullAddress == null ? d.isShowFullAddress() : showFullAddress)
        .showContractors(showContractors == null ? d.isShowContractors() : showContractors)
        .showDocuments(showDocuments == null ? d.isShowDocuments() : showDocuments)
        .showCosts(showCosts == null ? d.isShowCosts() : showCosts)
        .build();
  }

  @DynamoDbAttribute("showFullAddress")
  public Boolean getShowFullAddress() {
    return showFullAddress;
  }

  @DynamoDbAttribute("showContractors")
  public Boolean getShowContractors() {
    return showContractors;
  }

  @DynamoDbAttribute("showDocuments")
  public Boolean getShowDocuments() {
    return showDocuments;
  }

  @DynamoDbAttribute("showCosts")
  public Boolean getShowCosts() {
    return showCosts;
  }
}
