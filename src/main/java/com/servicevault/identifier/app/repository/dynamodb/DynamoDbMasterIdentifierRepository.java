package com.servicevault.identifier.app.repository.dynamodb;

import com.servicevault.identifier.app.exception.ConflictException;
import com.servicevault.identifier.app.model.IdentifierRecord;
import com.servicevault.identifier.app.model.MasterIdentifier;
import com.servicevault.identifier.app.model.PrivacySettings;
import com.servicevault.identifier.app.model.TokenRecord;
import com.servicevault.identifier.app.repository.MasterIdentifierRepository;
import java.time.Instant;
import java.util.*;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.enhanced.dynamodb.*;
import software.amazon.awssdk.enhanced.dynamodb.model.*;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

/**
 * Repository over two Enhanced DynamoDB tables: the per-property identifier record and the token
 * index. Regenerate and revoke touch both tables in a single {@code TransactWriteItems} call, so
 * no reader can observe two active tokens for one property.
 */
@Log4j2
public class DynamoDbMasterIdentifierRepository implements MasterIdentifierRepository {

  private final DynamoDbEnhancedClient enhanced;
  private final DynamoDbTable<IdentifierRecordItem> records;
  private final DynamoDbTable<IdentifierTokenItem> tokens;

  public DynamoDbMasterIdentifierRepository(
      DynamoDbClient ddb, String recordTableName, String tokenTableName) {
    this.enhanced = DynamoDbEnhancedClient.builder().dynamoDbClient(ddb).build();
    this.records =
        enhanced.table(recordTableName, TableSchema.fromBean(IdentifierRecordItem.class));
    this.tokens = enhanced.table(tokenTableName, TableSchema.fromBean(IdentifierTokenItem.class));
  }

  // -------- Reads --------

  @Override
  public Optional<IdentifierRecord> findByPropertyId(String propertyId) {
    if (propertyId == null) return Optional.empty();
    IdentifierRecordItem item =
        records.getItem(
            r -> r.key(Key.builder().partitionValue(propertyId).build()).consistentRead(true));
    return Optional.ofNullable(item).map(IdentifierRecordItem::toModel);
  }

  @Override
  public Optional<TokenRecord> findByToken(String token) {
    if (token == null) return Optional.empty();
    IdentifierTokenItem item =
        tokens.getItem(
            r -> r.key(Key.builder().partitionValue(token).build()).consistentRead(true));
    return Optional.ofNullable(item).map(IdentifierTokenItem::toModel);
  }

  // -------- Writes --------

  @Override
  public IdentifierRecord issue(
      String propertyId, String expectedCurrentToken, MasterIdentifier next) {
    Objects.requireNonNull(next, "next");
    Objects.requireNonNull(next.getToken(), "next.token");
    Instant now = next.getIssuedAt();

    IdentifierRecord issued =
        IdentifierRecord.builder()
            .propertyId(propertyId)
            .token(next.getToken())
            .issuedAt(now)
            .privacySettings(PrivacySettings.orDefaults(next.getPrivacySettings()))
            .updatedAt(now)
            .build();

    TransactWriteItemsEnhancedRequest.Builder tx = TransactWriteItemsEnhancedRequest.builder();

    tx.addPutItem(
        tokens,
        TransactPutItemEnhancedRequest.builder(IdentifierTokenItem.class)
            .item(
                IdentifierTokenItem.builder()
                    .token(next.getToken())
                    .propertyId(propertyId)
                    .issuedAt(now)
                    .build())
            .conditionExpression(notExists(IdentifierTokenItem.TOKEN))
            .build());

    if (expectedCurrentToken != null && isStillActive(expectedCurrentToken)) {
      tx.addUpdateItem(
          tokens,
          TransactUpdateItemEnhancedRequest.builder(IdentifierTokenItem.class)
              .item(
                  IdentifierTokenItem.builder().token(expectedCurrentToken).revokedAt(now).build())
              .ignoreNulls(true)
              .conditionExpression(
                  Expression.builder()
                      .expression("attribute_exists(#tk) AND attribute_not_exists(#ra)")
                      .putExpressionName("#tk", IdentifierTokenItem.TOKEN)
                      .putExpressionName("#ra", IdentifierTokenItem.REVOKED_AT)
                      .build())
              .build());
    }

    tx.addPutItem(
        records,
        TransactPutItemEnhancedRequest.builder(IdentifierRecordItem.class)
            .item(IdentifierRecordItem.from(issued))
            .conditionExpression(currentTokenIs(expectedCurrentToken))
            .build());

    try {
      enhanced.transactWriteItems(tx.build());
    } catch (TransactionCanceledException e) {
      if (!conditionFailed(e)) throw e;
      log.warn(
          "identifier.issue.conflict propertyId={} reasons={}",
          propertyId,
          e.cancellationReasons());
      throw ConflictException.race(propertyId);
    }

    log.info(
        "identifier.issue propertyId={} replaced={}", propertyId, expectedCurrentToken != null);
    return issued;
  }

  @Override
  public IdentifierRecord revoke(String propertyId, String token, Instant revokedAt) {
    Objects.requireNonNull(token, "token");

    TransactWriteItemsEnhancedRequest tx =
        TransactWriteItemsEnhancedRequest.builder()
            .addUpdateItem(
                records,
                TransactUpdateItemEnhancedRequest.builder(IdentifierRecordItem.class)
                    .item(
                        IdentifierRecordItem.builder()
                            .propertyId(propertyId)
                            .revokedAt(revokedAt)
                            .updatedAt(revokedAt)
                            .build())
                    .ignoreNulls(true)
                    .conditionExpression(
                        Expression.builder()
                            .expression("#tk = :tk AND attribute_not_exists(#ra)")
                            .putExpressionName("#tk", IdentifierRecordItem.TOKEN)
                            .putExpressionName("#ra", IdentifierRecordItem.REVOKED_AT)
                            .putExpressionValue(":tk", AttributeValue.builder().s(token).build())
                            .build())
                    .build())
            .addUpdateItem(
                tokens,
                TransactUpdateItemEnhancedRequest.builder(IdentifierTokenItem.class)
                    .item(IdentifierTokenItem.builder().token(token).revokedAt(revokedAt).build())
                    .ignoreNulls(true)
                    .conditionExpression(
                        Expression.builder()
                            .expression("attribute_exists(#tk) AND attribute_not_exists(#ra)")
                            .putExpressionName("#tk", IdentifierTokenItem.TOKEN)
                            .putExpressionName("#ra", IdentifierTokenItem.REVOKED_AT)
                            .build())
                    .build())
            .build();

    try {
      enhanced.transactWriteItems(tx);
      log.info("identifier.revoke propertyId={}", propertyId);
    } catch (TransactionCanceledException e) {
      if (!conditionFailed(e)) throw e;
      // already revoked or replaced by a newer token
      log.debug("identifier.revoke.noop propertyId={}", propertyId);
    }
    return findByPropertyId(propertyId).orElseGet(() -> IdentifierRecord.unissued(propertyId));
  }

  @Override
  public IdentifierRecord saveSettings(
      String propertyId, PrivacySettings settings, Instant updatedAt) {
    IdentifierRecordItem partial =
        IdentifierRecordItem.builder()
            .propertyId(propertyId)
            .privacySettings(PrivacySettingsItem.from(PrivacySettings.orDefaults(settings)))
            .updatedAt(updatedAt)
            .build();
    try {
      IdentifierRecordItem saved =
          records.updateItem(
              r ->
                  r.item(partial)
                      .ignoreNulls(true)
                      .conditionExpression(notExists(IdentifierRecordItem.REVOKED_AT)));
      log.info("identifier.saveSettings propertyId={}", propertyId);
      return saved.toModel();
    } catch (ConditionalCheckFailedException e) {
      throw ConflictException.revoked();
    }
  }

  // -------- Internals --------

  private boolean isStillActive(String token) {
    return findByToken(token).map(t -> !t.isRevoked()).orElse(false);
  }

  private static Expression notExists(String attribute) {
    return Expression.builder()
        .expression("attribute_not_exists(#a)")
        .putExpressionName("#a", attribute)
        .build();
  }

  private static Expression currentTokenIs(String expected) {
    if (expected == null) return notExists(IdentifierRecordItem.TOKEN);
    return Expression.builder()
        .expression("#tk = :expected")
        .putExpressionName("#tk", IdentifierRecordItem.TOKEN)
        .putExpressionValue(":expected", AttributeValue.builder().s(expected).build())
        .build();
  }

  private static boolean conditionFailed(TransactionCanceledException e) {
    if (!e.hasCancellationReasons()) return false;
    for (CancellationReason reason : e.cancellationReasons()) {
      if ("ConditionalCheckFailed".equals(reason.code())) return true;
    }
    return false;
  }
}
