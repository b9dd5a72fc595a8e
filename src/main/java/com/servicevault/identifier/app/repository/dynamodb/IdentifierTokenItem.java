package com.servicevault.identifier.app.repository.dynamodb;

import com.servicevault.identifier.app.model.TokenRecord;
import java.time.Instant;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/** Token index row. Rows are never deleted, so a revoked token stays revoked. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class IdentifierTokenItem {

  static final String TOKEN = "token";
  static final String REVOKED_AT = "revokedAt";

  /** Partition key. */
  private String token;

  private String propertyId;
  private Instant issuedAt;
  private Instant revokedAt;

  public TokenRecord toModel() {
    return TokenRecord.builder()
        .token(token)
        .propertyId(propertyId)
        .issuedAt(issuedAt)
        .revokedAt(revokedAt)
        .build();
  }

  @DynamoDbPartitionKey
  @DynamoDbAttribute(TOKEN)
  public String getToken() {
    return token;
  }

  @DynamoDbAttribute("propertyId")
  public String getPropertyId() {
    return propertyId;
  }

  @DynamoDbAttribute("issuedAt")
  public Instant getIssuedAt() {
    return issuedAt;
  }

  @DynamoDbAttribute(REVOKED_AT)
  public Instant getRevokedAt() {
    return revokedAt;
  }
}
