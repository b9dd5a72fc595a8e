package com.servicevault.identifier.app.repository.dynamodb;

import com.servicevault.identifier.app.model.IdentifierRecord;
import java.time.Instant;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/**
 * One row per property: the current token, its lifecycle timestamps and the privacy settings. A
 * row without a token holds pre-seeded settings for the first generate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class IdentifierRecordItem {

  static final String TOKEN = "token";
  static final String REVOKED_AT = "revokedAt";

  /** Partition key. */
  private String propertyId;

  private String token;
  private Instant issuedAt;
  private Instant revokedAt;
  private PrivacySettingsItem privacySettings;
  private Instant updatedAt;

  public static IdentifierRecordItem from(IdentifierRecord r) {
    return IdentifierRecordItem.builder()
        .propertyId(r.getPropertyId())
        .token(r.getToken())
        .issuedAt(r.getIssuedAt())
        .revokedAt(r.getRevokedAt())
        .privacySettings(PrivacySettingsItem.from(r.getPrivacySettings()))
        .updatedAt(r.getUpdatedAt())
        .build();
  }

  public IdentifierRecord toModel() {
    return IdentifierRecord.builder()
        .propertyId(propertyId)
        .token(token)
        .issuedAt(issuedAt)
        .revokedAt(revokedAt)
        .privacySettings(privacySettings == null ? null : privacySettings.toModel())
        .updatedAt(updatedAt)
        .build();
  }

  // ---------- DynamoDB mapping ----------

  @DynamoDbPartitionKey
  @DynamoDbAttribute("propertyId")
  public String getPropertyId() {
    return propertyId;
  }

  @DynamoDbAttribute(TOKEN)
  public String getToken() {
    return token;
  }

  @DynamoDbAttribute("issuedAt")
  public Instant getIssuedAt() {
    return issuedAt;
  }

  @DynamoDbAttribute(REVOKED_AT)
  public Instant getRevokedAt() {
    return revokedAt;
  }

  @DynamoDbAttribute("privacySettings")
  public PrivacySettingsItem getPrivacySettings() {
    return privacySettings;
  }

  @DynamoDbAttribute("updatedAt")
  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
