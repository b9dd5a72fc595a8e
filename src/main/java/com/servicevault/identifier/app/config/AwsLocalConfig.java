/**
 * AWS configuration package for the master identifier service.
 *
 * <p>Contains Spring configuration classes for AWS client beans.
 */
package com.servicevault.identifier.app.config;

import com.servicevault.identifier.app.repository.MasterIdentifierRepository;
import com.servicevault.identifier.app.repository.dynamodb.DynamoDbMasterIdentifierRepository;
import com.servicevault.identifier.app.service.DocumentLinkSigner;
import com.servicevault.identifier.app.service.S3DocumentLinkSigner;
import java.net.URI;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * AWS configuration for the local environment.
 *
 * <p>Uses static credentials from the application properties. Defines:
 *
 * <ul>
 *   <li>{@link DynamoDbClient} - identifier records and token index, optionally against DynamoDB
 *       Local through {@code aws.dynamodb.endpoint}.
 *   <li>{@link S3Presigner} - download links for property documents.
 * </ul>
 *
 * <p>Active only when the {@code local} Spring profile is enabled.
 */
@Configuration
@Profile("local")
public class AwsLocalConfig {

  /** AWS region in which the clients will operate. */
  @Value("${aws.region}")
  private String region;

  /** AWS access key ID for local development. */
  @Value("${aws.accessKeyId}")
  private String accessKeyId;

  /** AWS secret access key for local development. */
  @Value("${aws.secretAccessKey}")
  private String secretAccessKey;

  /** Endpoint override, e.g. http://localhost:8000 for DynamoDB Local. */
  @Value("${aws.dynamodb.endpoint:}")
  private String dynamoEndpoint;

  @Value("${dynamodb.identifier-table}")
  private String identifierTable;

  @Value("${dynamodb.token-table}")
  private String tokenTable;

  @Value("${aws.s3.bucket}")
  private String bucket;

  @Value("${aws.s3.document-link-ttl-minutes:15}")
  private long linkTtlMinutes;

  @Bean
  StaticCredentialsProvider awsCreds() {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(accessKeyId, secretAccessKey));
  }

  /**
   * Creates an Amazon DynamoDB client using static credentials.
   *
   * @return a configured {@link DynamoDbClient} for the specified AWS region.
   */
  @Bean
  public DynamoDbClient dynamoDbClient(StaticCredentialsProvider creds) {
    DynamoDbClientBuilder builder =
        DynamoDbClient.builder().region(Region.of(region)).credentialsProvider(creds);
    if (dynamoEndpoint != null && !dynamoEndpoint.isBlank()) {
      builder.endpointOverride(URI.create(dynamoEndpoint));
    }
    return builder.build();
  }

  @Bean
  S3Presigner s3Presigner(StaticCredentialsProvider creds) {
    return S3Presigner.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  public MasterIdentifierRepository masterIdentifierRepository(DynamoDbClient ddb) {
    return new DynamoDbMasterIdentifierRepository(ddb, identifierTable, tokenTable);
  }

  @Bean
  public DocumentLinkSigner documentLinkSigner(S3Presigner presigner) {
    return new S3DocumentLinkSigner(presigner, bucket, Duration.ofMinutes(linkTtlMinutes));
  }
}
